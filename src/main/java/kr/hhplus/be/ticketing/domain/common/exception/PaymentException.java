package kr.hhplus.be.ticketing.domain.common.exception;

import kr.hhplus.be.ticketing.domain.common.Address;

/**
 * 결제 토큰 관련 실패 (허용량 부족, 이체 실패, 출금 잔액 없음)
 * - 내부 재시도는 하지 않는다. 호출자가 다시 요청해야 한다
 */
public class PaymentException extends TicketingException {

    public PaymentException(String message) {
        super("PAYMENT_FAILED", message);
    }

    public PaymentException(String message, Throwable cause) {
        super("PAYMENT_FAILED", message, cause);
    }

    public static PaymentException insufficientAllowance(Address owner, long allowance, long required) {
        return new PaymentException(
                String.format("결제 허용량이 부족합니다. 지불자: %s, 허용량: %,d, 필요금액: %,d",
                        owner, allowance, required));
    }

    public static PaymentException transferFailed(Address from, Address to, long amount) {
        return new PaymentException(
                String.format("토큰 이체에 실패했습니다. %s -> %s, 금액: %,d", from, to, amount));
    }

    public static PaymentException nothingToWithdraw(Address token, Address holder) {
        return new PaymentException(
                String.format("출금할 잔액이 없습니다. 토큰: %s, 보유자: %s", token, holder));
    }
}
