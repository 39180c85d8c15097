package kr.hhplus.be.ticketing.web.platform.dto;

import kr.hhplus.be.ticketing.application.port.in.PlatformRegistryUseCase.PlatformInfo;

public record PlatformResponse(
        String address,
        String owner,
        int feeBps,
        String paymentToken,
        boolean paused
) {
    public static PlatformResponse from(PlatformInfo info) {
        return new PlatformResponse(
                info.address().value(),
                info.owner().value(),
                info.feeBps(),
                info.paymentToken().value(),
                info.paused()
        );
    }
}
