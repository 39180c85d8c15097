package kr.hhplus.be.ticketing.web.event.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import kr.hhplus.be.ticketing.web.common.CallerHeader;

public record ResellRequest(
        @NotBlank(message = "구매자 주소는 필수입니다")
        @Pattern(regexp = CallerHeader.ADDRESS_PATTERN, message = "주소 형식이 올바르지 않습니다")
        String to,

        @NotNull(message = "재판매 가격은 필수입니다")
        Long price
) {}
