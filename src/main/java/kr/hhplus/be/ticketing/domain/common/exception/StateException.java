package kr.hhplus.be.ticketing.domain.common.exception;

/**
 * 현재 생명주기 상태에서 허용되지 않는 작업 (이미 마감, 이미 초기화, 없음, 비활성 등)
 */
public class StateException extends TicketingException {

    public StateException(String message) {
        super("INVALID_STATE", message);
    }

    public static StateException notFound(String what, Object id) {
        return new StateException(what + " 을(를) 찾을 수 없습니다: " + id);
    }
}
