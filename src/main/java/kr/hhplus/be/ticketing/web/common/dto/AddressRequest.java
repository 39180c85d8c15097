package kr.hhplus.be.ticketing.web.common.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import kr.hhplus.be.ticketing.web.common.CallerHeader;

/**
 * 주소 하나를 받는 요청 (새 소유자, 결제 토큰, 이벤트 등)
 */
public record AddressRequest(
        @NotBlank(message = "주소는 필수입니다")
        @Pattern(regexp = CallerHeader.ADDRESS_PATTERN, message = "주소 형식이 올바르지 않습니다")
        String address
) {}
