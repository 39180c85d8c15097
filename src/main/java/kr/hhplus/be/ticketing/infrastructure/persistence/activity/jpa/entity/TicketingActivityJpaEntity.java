package kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.entity;

import jakarta.persistence.*;
import kr.hhplus.be.ticketing.application.event.ActivityType;

import java.time.Instant;

@Entity
@Table(
        name = "ticketing_activity",
        indexes = @Index(name = "idx_activity_subject", columnList = "subject, id")
)
public class TicketingActivityJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", length = 48, nullable = false)
    private ActivityType type;

    @Column(name = "subject", length = 42, nullable = false)
    private String subject;

    @Column(name = "actor", length = 42)
    private String actor;

    @Column(name = "counterparty", length = 42)
    private String counterparty;

    @Column(name = "amount")
    private Long amount;

    @Column(name = "fee")
    private Long fee;

    @Column(name = "ticket_id")
    private Long ticketId;

    @Column(name = "detail", length = 1024)
    private String detail;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    protected TicketingActivityJpaEntity() {}

    public TicketingActivityJpaEntity(ActivityType type, String subject, String actor, String counterparty,
                                      Long amount, Long fee, Long ticketId, String detail, Instant occurredAt) {
        this.type = type;
        this.subject = subject;
        this.actor = actor;
        this.counterparty = counterparty;
        this.amount = amount;
        this.fee = fee;
        this.ticketId = ticketId;
        this.detail = detail;
        this.occurredAt = occurredAt;
    }

    public Long getId() { return id; }
    public ActivityType getType() { return type; }
    public String getSubject() { return subject; }
    public String getActor() { return actor; }
    public String getCounterparty() { return counterparty; }
    public Long getAmount() { return amount; }
    public Long getFee() { return fee; }
    public Long getTicketId() { return ticketId; }
    public String getDetail() { return detail; }
    public Instant getOccurredAt() { return occurredAt; }
}
