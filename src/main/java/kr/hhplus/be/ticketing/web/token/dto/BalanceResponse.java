package kr.hhplus.be.ticketing.web.token.dto;

public record BalanceResponse(String token, String holder, long balance) {}
