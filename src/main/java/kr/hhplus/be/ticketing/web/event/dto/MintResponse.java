package kr.hhplus.be.ticketing.web.event.dto;

public record MintResponse(String event, long ticketId, long fee, long remainder) {}
