package kr.hhplus.be.ticketing.domain.series;

/**
 * 티켓 시리즈(이벤트) 상태
 * UNINITIALIZED → OPEN → CLOSED, CLOSED 는 최종 상태
 */
public enum SeriesState {

    UNINITIALIZED("미초기화"),
    OPEN("판매중"),
    CLOSED("마감");

    private final String displayName;

    SeriesState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean canTransitionTo(SeriesState target) {
        return switch (this) {
            case UNINITIALIZED -> target == OPEN;
            case OPEN -> target == CLOSED;
            case CLOSED -> false;
        };
    }
}
