package kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.repository;

import jakarta.persistence.LockModeType;
import kr.hhplus.be.ticketing.infrastructure.persistence.platform.jpa.entity.PlatformJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PlatformJpaRepository extends JpaRepository<PlatformJpaEntity, String> {

    // 관리자 변경 시 동시성 제어용 (행 잠금)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PlatformJpaEntity p where p.address = :address")
    Optional<PlatformJpaEntity> findForUpdate(@Param("address") String address);
}
