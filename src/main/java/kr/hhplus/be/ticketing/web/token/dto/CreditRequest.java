package kr.hhplus.be.ticketing.web.token.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import kr.hhplus.be.ticketing.web.common.CallerHeader;

public record CreditRequest(
        @NotBlank(message = "보유자 주소는 필수입니다")
        @Pattern(regexp = CallerHeader.ADDRESS_PATTERN, message = "주소 형식이 올바르지 않습니다")
        String holder,

        @Positive(message = "적립 금액은 0보다 커야 합니다")
        long amount
) {}
