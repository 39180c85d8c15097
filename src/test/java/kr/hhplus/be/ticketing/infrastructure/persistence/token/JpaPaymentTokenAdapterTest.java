package kr.hhplus.be.ticketing.infrastructure.persistence.token;

import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.adapter.JpaPaymentTokenAdapter;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenAllowanceJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenBalanceJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.entity.TokenLedgerJpaEntity;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenAllowanceJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenBalanceJpaRepository;
import kr.hhplus.be.ticketing.infrastructure.persistence.token.jpa.repository.TokenLedgerJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static kr.hhplus.be.ticketing.support.TestAddresses.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JpaPaymentTokenAdapterTest {

    private TokenBalanceJpaRepository balanceRepository;
    private TokenAllowanceJpaRepository allowanceRepository;
    private TokenLedgerJpaRepository ledgerRepository;
    private JpaPaymentTokenAdapter adapter;

    @BeforeEach
    void setUp() {
        balanceRepository = mock(TokenBalanceJpaRepository.class);
        allowanceRepository = mock(TokenAllowanceJpaRepository.class);
        ledgerRepository = mock(TokenLedgerJpaRepository.class);
        adapter = new JpaPaymentTokenAdapter(balanceRepository, allowanceRepository, ledgerRepository);
    }

    private TokenBalanceJpaEntity balanceOf(String holder, long amount) {
        TokenBalanceJpaEntity entity = new TokenBalanceJpaEntity(TOKEN.value(), holder);
        entity.increase(amount);
        return entity;
    }

    @Test
    void 허용량이_부족하면_false_를_반환하고_잔액은_그대로다() {
        // given
        TokenBalanceJpaEntity bob = balanceOf(BOB.value(), 500);
        when(allowanceRepository.findForUpdate(TOKEN.value(), BOB.value(), ALICE.value()))
                .thenReturn(Optional.of(new TokenAllowanceJpaEntity(TOKEN.value(), BOB.value(), ALICE.value(), 99)));

        // when
        boolean result = adapter.transferFrom(TOKEN, ALICE, BOB, CAROL, 100);

        // then
        assertThat(result).isFalse();
        assertThat(bob.getBalance()).isEqualTo(500);
        verify(ledgerRepository, never()).save(any());
    }

    @Test
    void 잔액이_부족하면_transfer_는_false_를_반환한다() {
        when(balanceRepository.findForUpdate(TOKEN.value(), BOB.value()))
                .thenReturn(Optional.of(balanceOf(BOB.value(), 10)));

        assertThat(adapter.transfer(TOKEN, BOB, CAROL, 11)).isFalse();
        verify(ledgerRepository, never()).save(any());
    }

    @Test
    void transferFrom_은_허용량을_차감하고_양쪽_원장을_남긴다() {
        // given
        TokenAllowanceJpaEntity allowance = new TokenAllowanceJpaEntity(TOKEN.value(), BOB.value(), ALICE.value(), 300);
        TokenBalanceJpaEntity bob = balanceOf(BOB.value(), 500);
        TokenBalanceJpaEntity carol = balanceOf(CAROL.value(), 0);
        when(allowanceRepository.findForUpdate(TOKEN.value(), BOB.value(), ALICE.value()))
                .thenReturn(Optional.of(allowance));
        when(balanceRepository.findForUpdate(TOKEN.value(), BOB.value())).thenReturn(Optional.of(bob));
        when(balanceRepository.findForUpdate(TOKEN.value(), CAROL.value())).thenReturn(Optional.of(carol));

        // when
        boolean result = adapter.transferFrom(TOKEN, ALICE, BOB, CAROL, 200);

        // then
        assertThat(result).isTrue();
        assertThat(allowance.getAmount()).isEqualTo(100);
        assertThat(bob.getBalance()).isEqualTo(300);
        assertThat(carol.getBalance()).isEqualTo(200);
        verify(ledgerRepository, times(2)).save(any(TokenLedgerJpaEntity.class));
    }

    @Test
    void 음수_금액은_거부된다() {
        assertThat(adapter.transfer(TOKEN, BOB, CAROL, -1)).isFalse();
        assertThat(adapter.transferFrom(TOKEN, ALICE, BOB, CAROL, -1)).isFalse();
        verifyNoInteractions(balanceRepository, allowanceRepository, ledgerRepository);
    }
}
