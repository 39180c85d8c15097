package kr.hhplus.be.ticketing.web.organization.dto;

import jakarta.validation.constraints.NotNull;

public record PriceRequest(
        @NotNull(message = "가격은 필수입니다")
        Long price
) {}
