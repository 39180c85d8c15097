package kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository;

import jakarta.persistence.LockModeType;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenAllowanceJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface TokenAllowanceJpaRepository extends JpaRepository<TokenAllowanceJpaEntity, Long> {

    Optional<TokenAllowanceJpaEntity> findByTokenAndOwnerAndSpender(String token, String owner, String spender);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        select a from TokenAllowanceJpaEntity a
        where a.token = :token and a.owner = :owner and a.spender = :spender
    """)
    Optional<TokenAllowanceJpaEntity> findForUpdate(@Param("token") String token,
                                                    @Param("owner") String owner,
                                                    @Param("spender") String spender);
}
