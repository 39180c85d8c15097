package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "platform")
public class PlatformJpaEntity {

    @Id
    @Column(name = "address", length = 42)
    private String address;

    @Column(name = "owner", length = 42, nullable = false, updatable = false)
    private String owner;

    @Column(name = "fee_bps", nullable = false)
    private int feeBps;

    @Column(name = "payment_token", length = 42, nullable = false)
    private String paymentToken;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Version
    private long version;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected PlatformJpaEntity() {}

    public PlatformJpaEntity(String address, String owner, int feeBps, String paymentToken, boolean paused) {
        this.address = address;
        this.owner = owner;
        this.feeBps = feeBps;
        this.paymentToken = paymentToken;
        this.paused = paused;
    }

    public String getAddress() { return address; }
    public String getOwner() { return owner; }
    public int getFeeBps() { return feeBps; }
    public String getPaymentToken() { return paymentToken; }
    public boolean isPaused() { return paused; }
    public long getVersion() { return version; }

    public void apply(int feeBps, String paymentToken, boolean paused) {
        this.feeBps = feeBps;
        this.paymentToken = paymentToken;
        this.paused = paused;
    }
}
