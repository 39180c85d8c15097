package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository;

import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.OrganizerAllowlistJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizerAllowlistJpaRepository extends JpaRepository<OrganizerAllowlistJpaEntity, String> {

    boolean existsByOrganizerAndAllowedTrue(String organizer);
}
