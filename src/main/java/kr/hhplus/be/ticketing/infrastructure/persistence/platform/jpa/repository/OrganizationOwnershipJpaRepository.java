package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository;

import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.OrganizationOwnershipJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface OrganizationOwnershipJpaRepository extends JpaRepository<OrganizationOwnershipJpaEntity, String> {

    Optional<OrganizationOwnershipJpaEntity> findByOwner(String owner);
}
