package kr.hhplus.be.ticketing.application.event;

/**
 * 외부 인덱싱용 활동 기록 종류
 */
public enum ActivityType {

    // 플랫폼 레지스트리
    ORGANIZATION_CREATED,
    ORGANIZATION_OWNERSHIP_TRANSFERRED,
    ORGANIZER_STATUS_UPDATED,
    PLATFORM_FEE_UPDATED,
    PAYMENT_TOKEN_UPDATED,
    PLATFORM_PAUSED,
    PLATFORM_UNPAUSED,
    PLATFORM_FEES_WITHDRAWN,
    EVENT_REGISTERED,
    EVENT_MARKED_CLOSED,

    // 조직
    BANNER_UPDATED,
    ORGANIZATION_PAUSED,
    ORGANIZATION_UNPAUSED,
    TOKENS_WITHDRAWN,

    // 팩토리 / 시리즈
    EVENT_CREATED,
    TICKET_MINTED,
    TICKET_RESOLD,
    TICKET_TRANSFERRED,
    TICKET_PRICE_UPDATED,
    DEADLINE_UPDATED,
    SERIES_CLOSED
}
