package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.domain.common.Address;

/**
 * 외부 결제 토큰(대체 가능 자산 원장) 포트
 * - 이체 메서드의 false 반환은 호출한 작업 전체를 중단시켜야 한다
 */
public interface PaymentTokenPort {

    long balanceOf(Address token, Address holder);

    long allowance(Address token, Address owner, Address spender);

    /**
     * from 이 보유한 잔액을 to 에게 이체 (from 자신이 호출하는 transfer)
     */
    boolean transfer(Address token, Address from, Address to, long amount);

    /**
     * spender 가 from 의 허용량을 사용해 to 에게 이체
     */
    boolean transferFrom(Address token, Address spender, Address from, Address to, long amount);
}
