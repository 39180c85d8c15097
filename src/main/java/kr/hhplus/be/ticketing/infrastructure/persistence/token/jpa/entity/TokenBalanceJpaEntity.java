package kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(
        name = "token_balance",
        uniqueConstraints = @UniqueConstraint(name = "uq_token_holder", columnNames = {"token", "holder"})
)
public class TokenBalanceJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token", length = 42, nullable = false, updatable = false)
    private String token;

    @Column(name = "holder", length = 42, nullable = false, updatable = false)
    private String holder;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Version
    private long version;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected TokenBalanceJpaEntity() {}

    public TokenBalanceJpaEntity(String token, String holder) {
        this.token = token;
        this.holder = holder;
        this.balance = 0L;
    }

    public Long getId() { return id; }
    public String getToken() { return token; }
    public String getHolder() { return holder; }
    public long getBalance() { return balance; }
    public long getVersion() { return version; }

    // 적립/수신
    public void increase(long amount) {
        if (amount < 0) throw new IllegalArgumentException("amount cannot be negative");
        this.balance = Math.addExact(this.balance, amount);
    }

    // 송신 차감
    public void decrease(long amount) {
        if (amount < 0) throw new IllegalArgumentException("amount cannot be negative");
        long next = this.balance - amount;
        if (next < 0) throw new IllegalArgumentException("insufficient balance");
        this.balance = next;
    }
}
