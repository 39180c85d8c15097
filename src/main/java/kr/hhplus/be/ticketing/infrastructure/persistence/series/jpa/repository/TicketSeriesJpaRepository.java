package kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.repository;

import jakarta.persistence.LockModeType;
import kr.hhplus.be.ticketing.infrastructure.persistence.series.jpa.entity.TicketSeriesJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TicketSeriesJpaRepository extends JpaRepository<TicketSeriesJpaEntity, String> {

    // 발행량 갱신 시 동시성 제어용 (행 잠금)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from TicketSeriesJpaEntity s where s.address = :address")
    Optional<TicketSeriesJpaEntity> findForUpdate(@Param("address") String address);
}
