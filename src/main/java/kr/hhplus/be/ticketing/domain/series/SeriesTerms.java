package kr.hhplus.be.ticketing.domain.series;

import kr.hhplus.be.ticketing.domain.common.Address;
import lombok.Builder;

import java.time.Instant;

/**
 * 시리즈 1회 초기화에 넘기는 판매 조건
 */
@Builder
public record SeriesTerms(
        Address organization,
        Address platform,
        String baseUri,
        long ticketPrice,
        Instant deadline,
        long maxSupply
) {}
