package kr.hhplus.be.ticketing.domain.common.exception;

import java.time.Instant;

/**
 * 입력값 검증 실패 (제로 주소, 0 이하의 가격/수량, 미래가 아닌 마감시각, 범위 밖 수수료율)
 */
public class ValidationException extends TicketingException {

    public ValidationException(String message) {
        super("INVALID_ARGUMENT", message);
    }

    public static ValidationException zeroAddress(String field) {
        return new ValidationException(field + " 는 제로 주소일 수 없습니다");
    }

    public static ValidationException nonPositivePrice(long price) {
        return new ValidationException("티켓 가격은 0보다 커야 합니다: " + price);
    }

    public static ValidationException nonPositiveSupply(long maxSupply) {
        return new ValidationException("최대 발행량은 0보다 커야 합니다: " + maxSupply);
    }

    public static ValidationException deadlineNotInFuture(Instant deadline, Instant now) {
        return new ValidationException(
                String.format("마감시각은 현재 이후여야 합니다. 마감: %s, 현재: %s", deadline, now));
    }

    public static ValidationException feeOutOfRange(int feeBps) {
        return new ValidationException("수수료율은 0~10000 bps 사이여야 합니다: " + feeBps);
    }
}
