package kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Table(
        name = "token_ledger",
        indexes = @Index(name = "idx_token_ledger_holder", columnList = "token, holder")
)
public class TokenLedgerJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token", length = 42, nullable = false)
    private String token;

    @Column(name = "holder", length = 42, nullable = false)
    private String holder;

    @Column(name = "amount", nullable = false)
    private long amount; // 적립/수신:+, 송신:-

    @Column(name = "reason", nullable = false, length = 32)
    private String reason; // CREDIT / TRANSFER_IN / TRANSFER_OUT

    @Column(name = "counterparty", length = 42)
    private String counterparty;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected TokenLedgerJpaEntity() {}

    public TokenLedgerJpaEntity(String token, String holder, long amount, String reason, String counterparty) {
        this.token = token;
        this.holder = holder;
        this.amount = amount;
        this.reason = reason;
        this.counterparty = counterparty;
    }

    public Long getId() { return id; }
    public String getToken() { return token; }
    public String getHolder() { return holder; }
    public long getAmount() { return amount; }
    public String getReason() { return reason; }
    public String getCounterparty() { return counterparty; }
    public Instant getCreatedAt() { return createdAt; }
}
