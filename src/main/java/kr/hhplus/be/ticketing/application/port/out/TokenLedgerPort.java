package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;

/**
 * 로컬 토큰 원장 (개발/테스트용 결제 토큰)
 * - 잔액 적립과 허용량 설정을 추가로 제공한다
 */
public interface TokenLedgerPort extends PaymentTokenPort {

    void credit(Address token, Address holder, long amount);

    void approve(Address token, Address owner, Address spender, long amount);
}
