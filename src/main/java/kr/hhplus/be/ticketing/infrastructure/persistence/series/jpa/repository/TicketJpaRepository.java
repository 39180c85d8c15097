package kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.repository;

import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.entity.TicketJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TicketJpaRepository extends JpaRepository<TicketJpaEntity, Long> {

    Optional<TicketJpaEntity> findBySeriesAndTicketId(String series, long ticketId);

    @Query("select t.ticketId from TicketJpaEntity t where t.series = :series and t.holder = :holder order by t.ticketId")
    List<Long> findTicketIds(@Param("series") String series, @Param("holder") String holder);

    long countBySeriesAndHolder(String series, String holder);
}
