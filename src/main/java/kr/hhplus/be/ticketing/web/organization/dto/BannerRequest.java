package kr.hhplus.be.ticketing.web.organization.dto;

import jakarta.validation.constraints.NotNull;

public record BannerRequest(
        @NotNull(message = "배너 URI는 필수입니다")
        String uri
) {}
