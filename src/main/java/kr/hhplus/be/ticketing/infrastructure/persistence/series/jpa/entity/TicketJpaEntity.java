package kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.entity;

import jakarta.persistence.*;

@Entity
@Table(
        name = "ticket",
        uniqueConstraints = @UniqueConstraint(name = "uq_ticket_series_id", columnNames = {"series", "ticket_id"}),
        indexes = @Index(name = "idx_ticket_holder", columnList = "series, holder")
)
public class TicketJpaEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "series", length = 42, nullable = false, updatable = false)
    private String series;

    @Column(name = "ticket_id", nullable = false, updatable = false)
    private long ticketId;

    @Column(name = "holder", length = 42, nullable = false)
    private String holder;

    protected TicketJpaEntity() {}

    public TicketJpaEntity(String series, long ticketId, String holder) {
        this.series = series;
        this.ticketId = ticketId;
        this.holder = holder;
    }

    public Long getId() { return id; }
    public String getSeries() { return series; }
    public long getTicketId() { return ticketId; }
    public String getHolder() { return holder; }

    public void setHolder(String holder) {
        this.holder = holder;
    }
}
