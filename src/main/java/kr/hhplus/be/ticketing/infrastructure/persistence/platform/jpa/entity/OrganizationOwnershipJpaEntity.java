package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity;

import jakarta.persistence.*;

/**
 * 소유자 ↔ 조직 매핑. 행 하나가 양방향을 모두 표현하므로 두 방향이 어긋날 수 없다
 */
@Entity
@Table(
        name = "organization_ownership",
        uniqueConstraints = @UniqueConstraint(name = "uq_ownership_owner", columnNames = "owner")
)
public class OrganizationOwnershipJpaEntity {

    @Id
    @Column(name = "organization", length = 42)
    private String organization;

    @Column(name = "owner", length = 42, nullable = false)
    private String owner;

    protected OrganizationOwnershipJpaEntity() {}

    public OrganizationOwnershipJpaEntity(String organization, String owner) {
        this.organization = organization;
        this.owner = owner;
    }

    public String getOrganization() { return organization; }
    public String getOwner() { return owner; }

    public void setOwner(String owner) {
        this.owner = owner;
    }
}
