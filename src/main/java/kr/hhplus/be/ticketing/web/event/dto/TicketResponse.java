package kr.hhplus.be.ticketing.web.event.dto;

public record TicketResponse(
        String event,
        long ticketId,
        String owner,
        String tokenUri,
        boolean valid
) {}
