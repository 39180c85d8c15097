package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.port.in.TokenLedgerUseCase;
import kr.hhplus.be.ticketing.application.port.out.TokenLedgerPort;
import kr.hhplus.be.ticketing.application.support.LedgerExecutor;
import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 로컬 결제 토큰 원장 서비스
 * - 적립/허용량 변경도 원장 락 안에서 실행되어 진행 중인 결제와 섞이지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenLedgerService implements TokenLedgerUseCase {

    private final TokenLedgerPort tokenLedgerPort;
    private final LedgerExecutor ledger;

    @Override
    public long credit(CreditCommand command) {
        requireNonZero(command.token(), "token");
        requireNonZero(command.holder(), "holder");
        if (command.amount() <= 0) {
            throw new ValidationException("적립 금액은 0보다 커야 합니다: " + command.amount());
        }

        return ledger.execute(() -> {
            tokenLedgerPort.credit(command.token(), command.holder(), command.amount());
            long balance = tokenLedgerPort.balanceOf(command.token(), command.holder());
            log.info("토큰 적립 - token: {}, holder: {}, amount: {}, balance: {}",
                    command.token(), command.holder(), command.amount(), balance);
            return balance;
        });
    }

    @Override
    public void approve(ApproveCommand command) {
        requireNonZero(command.token(), "token");
        requireNonZero(command.owner(), "owner");
        requireNonZero(command.spender(), "spender");
        if (command.amount() < 0) {
            throw new ValidationException("허용량은 음수일 수 없습니다: " + command.amount());
        }

        ledger.run(() -> {
            tokenLedgerPort.approve(command.token(), command.owner(), command.spender(), command.amount());
            log.info("허용량 설정 - token: {}, owner: {}, spender: {}, amount: {}",
                    command.token(), command.owner(), command.spender(), command.amount());
        });
    }

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(Address token, Address holder) {
        return tokenLedgerPort.balanceOf(token, holder);
    }

    @Override
    @Transactional(readOnly = true)
    public long allowance(Address token, Address owner, Address spender) {
        return tokenLedgerPort.allowance(token, owner, spender);
    }

    private static void requireNonZero(Address address, String field) {
        if (address == null || address.isZero()) {
            throw ValidationException.zeroAddress(field);
        }
    }
}
