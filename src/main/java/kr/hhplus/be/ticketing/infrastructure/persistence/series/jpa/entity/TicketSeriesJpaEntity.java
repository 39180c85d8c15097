package kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.entity;

import jakarta.persistence.*;
import kr.hhplus.be.ticketing.domain.series.SeriesState;

import java.time.Instant;

@Entity
@Table(
        name = "ticket_series",
        indexes = @Index(name = "idx_series_organization", columnList = "organization")
)
public class TicketSeriesJpaEntity {

    @Id
    @Column(name = "address", length = 42)
    private String address;

    @Column(name = "template_id", length = 64, nullable = false, updatable = false)
    private String templateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", length = 16, nullable = false)
    private SeriesState state;

    @Column(name = "organization", length = 42, nullable = false, updatable = false)
    private String organization;

    @Column(name = "platform", length = 42, nullable = false, updatable = false)
    private String platform;

    @Column(name = "base_uri", length = 1024, nullable = false, updatable = false)
    private String baseUri;

    @Column(name = "ticket_price", nullable = false)
    private long ticketPrice;

    @Column(name = "deadline", nullable = false)
    private Instant deadline;

    @Column(name = "max_supply", nullable = false, updatable = false)
    private long maxSupply;

    @Column(name = "current_supply", nullable = false)
    private long currentSupply;

    @Version
    private long version;

    protected TicketSeriesJpaEntity() {}

    public TicketSeriesJpaEntity(String address, String templateId, String organization, String platform,
                                 String baseUri, long maxSupply) {
        this.address = address;
        this.templateId = templateId;
        this.organization = organization;
        this.platform = platform;
        this.baseUri = baseUri;
        this.maxSupply = maxSupply;
    }

    public String getAddress() { return address; }
    public String getTemplateId() { return templateId; }
    public SeriesState getState() { return state; }
    public String getOrganization() { return organization; }
    public String getPlatform() { return platform; }
    public String getBaseUri() { return baseUri; }
    public long getTicketPrice() { return ticketPrice; }
    public Instant getDeadline() { return deadline; }
    public long getMaxSupply() { return maxSupply; }
    public long getCurrentSupply() { return currentSupply; }
    public long getVersion() { return version; }

    public void apply(SeriesState state, long ticketPrice, Instant deadline, long currentSupply) {
        this.state = state;
        this.ticketPrice = ticketPrice;
        this.deadline = deadline;
        this.currentSupply = currentSupply;
    }
}
