package kr.hhplus.be.ticketing.domain.common.exception;

import kr.hhplus.be.ticketing.domain.common.Address;

/**
 * 보호된 작업을 권한 없는 호출자가 실행한 경우
 */
public class AuthorizationException extends TicketingException {

    public AuthorizationException(String message) {
        super("UNAUTHORIZED", message);
    }

    public static AuthorizationException notOwner(Address caller, Address owner) {
        return new AuthorizationException(
                String.format("소유자만 호출할 수 있습니다. 호출자: %s, 소유자: %s", caller, owner));
    }

    public static AuthorizationException notAdmin(Address caller) {
        return new AuthorizationException("플랫폼 관리자만 호출할 수 있습니다. 호출자: " + caller);
    }

    public static AuthorizationException notPlatform(Address caller) {
        return new AuthorizationException("플랫폼만 호출할 수 있습니다. 호출자: " + caller);
    }

    public static AuthorizationException notOrganization(Address caller) {
        return new AuthorizationException("등록된 조직만 호출할 수 있습니다. 호출자: " + caller);
    }

    public static AuthorizationException notAllowedOrganizer(Address caller) {
        return new AuthorizationException("조직 생성이 허용되지 않은 주소입니다: " + caller);
    }

    public static AuthorizationException notHolder(Address caller, long ticketId) {
        return new AuthorizationException(
                String.format("티켓 보유자가 아닙니다. 호출자: %s, 티켓: %d", caller, ticketId));
    }
}
