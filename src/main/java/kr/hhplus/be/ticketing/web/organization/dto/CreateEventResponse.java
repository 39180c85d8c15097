package kr.hhplus.be.ticketing.web.organization.dto;

public record CreateEventResponse(String organization, String event) {}
