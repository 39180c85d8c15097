package kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.repository;

import kr.hhplus.be.ticketing.infrastructure.persistence.activity.jpa.entity.TicketingActivityJpaEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TicketingActivityJpaRepository extends JpaRepository<TicketingActivityJpaEntity, Long> {

    List<TicketingActivityJpaEntity> findBySubjectOrderByIdDesc(String subject, Pageable pageable);
}
