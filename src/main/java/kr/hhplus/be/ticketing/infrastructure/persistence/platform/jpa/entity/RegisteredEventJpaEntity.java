package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity;

import jakarta.persistence.*;
import kr.hhplus.be.ticketing.domain.platform.EventRegistrationStatus;

import java.time.Instant;

@Entity
@Table(
        name = "registered_event",
        indexes = {
                @Index(name = "idx_registered_event_status", columnList = "status, registered_at"),
                @Index(name = "idx_registered_event_org", columnList = "organization")
        }
)
public class RegisteredEventJpaEntity {

    @Id
    @Column(name = "event", length = 42)
    private String event;

    @Column(name = "organization", length = 42, nullable = false)
    private String organization;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private EventRegistrationStatus status;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    protected RegisteredEventJpaEntity() {}

    public RegisteredEventJpaEntity(String event, String organization, EventRegistrationStatus status,
                                    Instant registeredAt, Instant closedAt) {
        this.event = event;
        this.organization = organization;
        this.status = status;
        this.registeredAt = registeredAt;
        this.closedAt = closedAt;
    }

    public String getEvent() { return event; }
    public String getOrganization() { return organization; }
    public EventRegistrationStatus getStatus() { return status; }
    public Instant getRegisteredAt() { return registeredAt; }
    public Instant getClosedAt() { return closedAt; }

    public void updateStatus(EventRegistrationStatus status, Instant closedAt) {
        this.status = status;
        this.closedAt = closedAt;
    }
}
