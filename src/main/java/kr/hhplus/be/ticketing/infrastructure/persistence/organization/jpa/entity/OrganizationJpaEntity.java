package kr.hhplus.be.ticketing.infrastructure.persistence.organization.jpa.entity;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "organization")
public class OrganizationJpaEntity {

    @Id
    @Column(name = "address", length = 42)
    private String address;

    @Column(name = "platform", length = 42, nullable = false, updatable = false)
    private String platform;

    @Column(name = "owner", length = 42, nullable = false)
    private String owner;

    @Column(name = "banner_uri", length = 1024, nullable = false)
    private String bannerUri;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private long version;

    protected OrganizationJpaEntity() {}

    public OrganizationJpaEntity(String address, String platform, String owner, String bannerUri,
                                 boolean paused, Instant createdAt) {
        this.address = address;
        this.platform = platform;
        this.owner = owner;
        this.bannerUri = bannerUri;
        this.paused = paused;
        this.createdAt = createdAt;
    }

    public String getAddress() { return address; }
    public String getPlatform() { return platform; }
    public String getOwner() { return owner; }
    public String getBannerUri() { return bannerUri; }
    public boolean isPaused() { return paused; }
    public Instant getCreatedAt() { return createdAt; }
    public long getVersion() { return version; }

    public void apply(String owner, String bannerUri, boolean paused) {
        this.owner = owner;
        this.bannerUri = bannerUri;
        this.paused = paused;
    }
}
