package kr.hhplus.be.ticketing.web.organization.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * 이벤트 생성 요청. 양수/미래 검증은 도메인에서 수행한다
 */
public record CreateEventRequest(
        @NotNull(message = "메타데이터 URI는 필수입니다")
        String uri,

        @NotNull(message = "티켓 가격은 필수입니다")
        Long ticketPrice,

        @NotNull(message = "판매 마감시각은 필수입니다")
        Instant deadline,

        @NotNull(message = "최대 발행량은 필수입니다")
        Long maxSupply
) {}
