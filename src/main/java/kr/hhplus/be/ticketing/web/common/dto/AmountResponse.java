package kr.hhplus.be.ticketing.web.common.dto;

public record AmountResponse(String token, long amount) {}
