package kr.hhplus.be.ticketing.web.event.dto;

import java.util.List;

public record HolderResponse(String event, String holder, long balance, List<Long> ticketIds) {}
