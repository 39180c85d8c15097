package kr.hhplus.be.ticketing.web.platform.dto;

/**
 * 레지스트리 조회 결과. 매핑이 없으면 상대 주소는 null
 */
public record OrganizationLookupResponse(
        String owner,
        String organization,
        boolean registered
) {}
