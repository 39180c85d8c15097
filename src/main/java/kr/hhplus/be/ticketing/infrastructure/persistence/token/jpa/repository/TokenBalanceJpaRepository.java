package kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository;

import jakarta.persistence.LockModeType;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenBalanceJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TokenBalanceJpaRepository extends JpaRepository<TokenBalanceJpaEntity, Long> {

    Optional<TokenBalanceJpaEntity> findByTokenAndHolder(String token, String holder);

    // 이체 시 동시성 제어용 (행 잠금)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from TokenBalanceJpaEntity b where b.token = :token and b.holder = :holder")
    Optional<TokenBalanceJpaEntity> findForUpdate(@Param("token") String token, @Param("holder") String holder);
}
