package kr.hhplus.be.ticketing.domain.common.exception;

/**
 * 티켓팅 코어 예외의 공통 부모
 * - 모든 예외는 작업 전체를 중단시키며 부분 반영은 없다
 * - errorCode 는 API 응답 코드로 그대로 노출된다
 */
public abstract class TicketingException extends RuntimeException {

    private final String errorCode;

    protected TicketingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected TicketingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
