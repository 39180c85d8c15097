package kr.hhplus.be.ticketing.web.platform.dto;

import jakarta.validation.constraints.NotNull;

public record StatusRequest(
        @NotNull(message = "상태 값은 필수입니다")
        Boolean enabled
) {}
