package kr.hhplus.be.ticketing.web.event.dto;

import kr.hhplus.be.ticketing.application.port.in.TicketSeriesUseCase.SeriesInfo;

import java.time.Instant;

public record SeriesResponse(
        String address,
        String organization,
        String platform,
        String templateId,
        String baseUri,
        long ticketPrice,
        Instant deadline,
        long maxSupply,
        long currentSupply,
        String state
) {
    public static SeriesResponse from(SeriesInfo info) {
        return new SeriesResponse(
                info.address().value(),
                info.organization().value(),
                info.platform().value(),
                info.templateId(),
                info.baseUri(),
                info.ticketPrice(),
                info.deadline(),
                info.maxSupply(),
                info.currentSupply(),
                info.state().name()
        );
    }
}
