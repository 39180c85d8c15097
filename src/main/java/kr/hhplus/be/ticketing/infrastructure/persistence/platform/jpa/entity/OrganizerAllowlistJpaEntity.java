package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity;

import jakarta.persistence.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "organizer_allowlist")
public class OrganizerAllowlistJpaEntity {

    @Id
    @Column(name = "organizer", length = 42)
    private String organizer;

    @Column(name = "allowed", nullable = false)
    private boolean allowed;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected OrganizerAllowlistJpaEntity() {}

    public OrganizerAllowlistJpaEntity(String organizer, boolean allowed) {
        this.organizer = organizer;
        this.allowed = allowed;
    }

    public String getOrganizer() { return organizer; }
    public boolean isAllowed() { return allowed; }

    public void setAllowed(boolean allowed) {
        this.allowed = allowed;
    }
}
