package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository;

import kr.hhplus.be.ticketing.domain.platform.EventRegistrationStatus;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.RegisteredEventJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RegisteredEventJpaRepository extends JpaRepository<RegisteredEventJpaEntity, String> {

    List<RegisteredEventJpaEntity> findByStatusOrderByRegisteredAtAsc(EventRegistrationStatus status);

    List<RegisteredEventJpaEntity> findByOrganizationOrderByRegisteredAtAsc(String organization);
}
