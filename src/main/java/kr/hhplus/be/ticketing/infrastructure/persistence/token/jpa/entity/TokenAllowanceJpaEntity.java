package kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(
        name = "token_allowance",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_token_allowance",
                columnNames = {"token", "owner", "spender"}
        ))
public class TokenAllowanceJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token", length = 42, nullable = false, updatable = false)
    private String token;

    @Column(name = "owner", length = 42, nullable = false, updatable = false)
    private String owner;

    @Column(name = "spender", length = 42, nullable = false, updatable = false)
    private String spender;

    @Column(name = "amount", nullable = false)
    private long amount;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected TokenAllowanceJpaEntity() {}

    public TokenAllowanceJpaEntity(String token, String owner, String spender, long amount) {
        this.token = token;
        this.owner = owner;
        this.spender = spender;
        this.amount = amount;
    }

    public String getToken() { return token; }
    public String getOwner() { return owner; }
    public String getSpender() { return spender; }
    public long getAmount() { return amount; }

    public void setAmount(long amount) {
        this.amount = amount;
    }

    public void consume(long spent) {
        long next = this.amount - spent;
        if (next < 0) throw new IllegalArgumentException("insufficient allowance");
        this.amount = next;
    }
}
