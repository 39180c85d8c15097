package kr.hhplus.be.ticketing.web.organization.dto;

import kr.hhplus.be.ticketing.application.port.in.OrganizationUseCase.OrganizationInfo;
import kr.hhplus.be.ticketing.domain.common.Address;

import java.util.List;

public record OrganizationResponse(
        String address,
        String owner,
        String platform,
        String bannerUri,
        boolean paused,
        List<String> events
) {
    public static OrganizationResponse from(OrganizationInfo info, List<Address> events) {
        return new OrganizationResponse(
                info.address().value(),
                info.owner().value(),
                info.platform().value(),
                info.bannerUri(),
                info.paused(),
                events.stream().map(Address::value).toList()
        );
    }
}
