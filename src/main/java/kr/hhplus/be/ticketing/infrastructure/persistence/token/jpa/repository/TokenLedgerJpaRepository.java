package kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository;

import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenLedgerJpaEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TokenLedgerJpaRepository extends JpaRepository<TokenLedgerJpaEntity, Long> {

    List<TokenLedgerJpaEntity> findByTokenAndHolderOrderByIdAsc(String token, String holder);
}
