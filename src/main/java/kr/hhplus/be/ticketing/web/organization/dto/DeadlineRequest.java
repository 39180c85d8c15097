package kr.hhplus.be.ticketing.web.organization.dto;

import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record DeadlineRequest(
        @NotNull(message = "마감시각은 필수입니다")
        Instant deadline
) {}
