package kr.hhplus.be.ticketing.web.common;

/**
 * 호출자 식별 헤더. 서명 검증은 이 서비스 앞단(게이트웨이)의 책임이다
 */
public final class CallerHeader {

    public static final String NAME = "X-Caller-Address";

    public static final String ADDRESS_PATTERN = "^0x[0-9a-fA-F]{40}$";

    private CallerHeader() {}
}
