package kr.hhplus.be.ticketing.web.platform.dto;

import jakarta.validation.constraints.NotNull;

public record FeeRequest(
        // 범위 검증(0~10000)은 도메인에서
        @NotNull(message = "수수료율은 필수입니다")
        Integer feeBps
) {}
