package kr.hhplus.be.ticketing.web.token.dto;

public record AllowanceResponse(String token, String owner, String spender, long amount) {}
