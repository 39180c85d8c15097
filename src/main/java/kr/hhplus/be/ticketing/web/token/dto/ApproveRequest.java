package kr.hhplus.be.ticketing.web.token.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import kr.hhplus.be.ticketing.web.common.CallerHeader;

public record ApproveRequest(
        @NotBlank(message = "사용자(spender) 주소는 필수입니다")
        @Pattern(regexp = CallerHeader.ADDRESS_PATTERN, message = "주소 형식이 올바르지 않습니다")
        String spender,

        @PositiveOrZero(message = "허용량은 음수일 수 없습니다")
        long amount
) {}
