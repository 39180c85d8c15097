package kr.hhplus.be.ticketing.domain.platform;

/**
 * 레지스트리 수준의 이벤트 분류 (활성 / 지난 이벤트)
 */
public enum EventRegistrationStatus {
    ACTIVE,
    PAST
}
