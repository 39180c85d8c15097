package kr.hhplus.be.ticketing.domain.platform;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.StateException;

import java.time.Instant;
import java.util.Objects;

/**
 * 플랫폼 레지스트리에 등록된 이벤트
 * - ACTIVE → PAST 한 방향으로만 이동
 */
public class RegisteredEvent {

    private final Address event;
    private final Address organization;
    private final Instant registeredAt;
    private EventRegistrationStatus status;
    private Instant closedAt;

    private RegisteredEvent(Address event, Address organization, EventRegistrationStatus status,
                            Instant registeredAt, Instant closedAt) {
        this.event = Objects.requireNonNull(event, "이벤트 주소는 필수입니다");
        this.organization = Objects.requireNonNull(organization, "조직 주소는 필수입니다");
        this.status = Objects.requireNonNull(status, "상태는 필수입니다");
        this.registeredAt = registeredAt;
        this.closedAt = closedAt;
    }

    public static RegisteredEvent register(Address event, Address organization, Instant registeredAt) {
        return new RegisteredEvent(event, organization, EventRegistrationStatus.ACTIVE, registeredAt, null);
    }

    public static RegisteredEvent restore(Address event, Address organization, EventRegistrationStatus status,
                                          Instant registeredAt, Instant closedAt) {
        return new RegisteredEvent(event, organization, status, registeredAt, closedAt);
    }

    public void markClosed(Instant closedAt) {
        if (status != EventRegistrationStatus.ACTIVE) {
            throw new StateException("활성 이벤트가 아닙니다: " + event);
        }
        this.status = EventRegistrationStatus.PAST;
        this.closedAt = closedAt;
    }

    public boolean isActive() {
        return status == EventRegistrationStatus.ACTIVE;
    }

    public Address getEvent() { return event; }
    public Address getOrganization() { return organization; }
    public EventRegistrationStatus getStatus() { return status; }
    public Instant getRegisteredAt() { return registeredAt; }
    public Instant getClosedAt() { return closedAt; }
}
