package kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.adapter;

import kr.hhplus.be.ticketing.application.port.out.TokenLedgerPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenAllowanceJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenBalanceJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenLedgerJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenAllowanceJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenBalanceJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenLedgerJpaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 로컬 결제 토큰 원장 JPA 어댑터
 * - 잔액/허용량 부족 시 예외 대신 false 를 반환한다 (호출 측이 작업 전체를 중단)
 * - 모든 잔액 변동은 token_ledger 에 기록된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaPaymentTokenAdapter implements TokenLedgerPort {

    private static final String REASON_CREDIT = "CREDIT";
    private static final String REASON_TRANSFER_IN = "TRANSFER_IN";
    private static final String REASON_TRANSFER_OUT = "TRANSFER_OUT";

    private final TokenBalanceJpaRepository balanceRepo;
    private final TokenAllowanceJpaRepository allowanceRepo;
    private final TokenLedgerJpaRepository ledgerRepo;

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(Address token, Address holder) {
        return balanceRepo.findByTokenAndHolder(token.value(), holder.value())
                .map(TokenBalanceJpaEntity::getBalance)
                .orElse(0L);
    }

    @Override
    @Transactional(readOnly = true)
    public long allowance(Address token, Address owner, Address spender) {
        return allowanceRepo.findByTokenAndOwnerAndSpender(token.value(), owner.value(), spender.value())
                .map(TokenAllowanceJpaEntity::getAmount)
                .orElse(0L);
    }

    @Override
    @Transactional
    public boolean transfer(Address token, Address from, Address to, long amount) {
        if (amount < 0) {
            return false;
        }
        TokenBalanceJpaEntity source = loadBalance(token, from);
        if (source.getBalance() < amount) {
            log.debug("잔액 부족 - token: {}, holder: {}, balance: {}, amount: {}",
                    token, from, source.getBalance(), amount);
            return false;
        }
        move(token, source, from, to, amount);
        return true;
    }

    @Override
    @Transactional
    public boolean transferFrom(Address token, Address spender, Address from, Address to, long amount) {
        if (amount < 0) {
            return false;
        }
        TokenAllowanceJpaEntity allowance = allowanceRepo
                .findForUpdate(token.value(), from.value(), spender.value())
                .orElse(null);
        if (allowance == null || allowance.getAmount() < amount) {
            log.debug("허용량 부족 - token: {}, owner: {}, spender: {}, amount: {}", token, from, spender, amount);
            return false;
        }

        TokenBalanceJpaEntity source = loadBalance(token, from);
        if (source.getBalance() < amount) {
            log.debug("잔액 부족 - token: {}, holder: {}, balance: {}, amount: {}",
                    token, from, source.getBalance(), amount);
            return false;
        }

        allowance.consume(amount);
        allowanceRepo.save(allowance);
        move(token, source, from, to, amount);
        return true;
    }

    @Override
    @Transactional
    public void credit(Address token, Address holder, long amount) {
        TokenBalanceJpaEntity balance = loadBalance(token, holder);
        balance.increase(amount);
        balanceRepo.save(balance);
        ledgerRepo.save(new TokenLedgerJpaEntity(token.value(), holder.value(), amount, REASON_CREDIT, null));
    }

    @Override
    @Transactional
    public void approve(Address token, Address owner, Address spender, long amount) {
        TokenAllowanceJpaEntity allowance = allowanceRepo
                .findForUpdate(token.value(), owner.value(), spender.value())
                .orElseGet(() -> new TokenAllowanceJpaEntity(token.value(), owner.value(), spender.value(), amount));
        allowance.setAmount(amount);
        allowanceRepo.save(allowance);
    }

    // === Private Helper Methods ===

    private TokenBalanceJpaEntity loadBalance(Address token, Address holder) {
        return balanceRepo.findForUpdate(token.value(), holder.value())
                .orElseGet(() -> balanceRepo.save(new TokenBalanceJpaEntity(token.value(), holder.value())));
    }

    private void move(Address token, TokenBalanceJpaEntity source, Address from, Address to, long amount) {
        source.decrease(amount);
        balanceRepo.save(source);

        TokenBalanceJpaEntity target = loadBalance(token, to);
        target.increase(amount);
        balanceRepo.save(target);

        ledgerRepo.save(new TokenLedgerJpaEntity(token.value(), from.value(), -amount, REASON_TRANSFER_OUT, to.value()));
        ledgerRepo.save(new TokenLedgerJpaEntity(token.value(), to.value(), amount, REASON_TRANSFER_IN, from.value()));
    }
}
