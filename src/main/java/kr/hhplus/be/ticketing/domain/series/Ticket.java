package kr.hhplus.be.ticketing.domain.series;

import kr.hhplus.be.ticketing.domain.common.Address;
import kr.hhplus.be.ticketing.domain.common.exception.AuthorizationException;
import kr.hhplus.be.ticketing.domain.common.exception.ValidationException;

import java.util.Objects;

/**
 * 시리즈 안에서 발행된 티켓 한 장 (ticketId → 보유자)
 */
public class Ticket {

    private final Address series;
    private final long ticketId;
    private Address holder;

    private Ticket(Address series, long ticketId, Address holder) {
        this.series = Objects.requireNonNull(series, "시리즈 주소는 필수입니다");
        this.ticketId = ticketId;
        this.holder = Objects.requireNonNull(holder, "보유자는 필수입니다");
    }

    static Ticket issue(Address series, long ticketId, Address holder) {
        if (holder.isZero()) {
            throw ValidationException.zeroAddress("holder");
        }
        return new Ticket(series, ticketId, holder);
    }

    public static Ticket restore(Address series, long ticketId, Address holder) {
        return new Ticket(series, ticketId, holder);
    }

    public void requireHeldBy(Address caller) {
        if (!holder.equals(caller)) {
            throw AuthorizationException.notHolder(caller, ticketId);
        }
    }

    void moveTo(Address from, Address to) {
        requireHeldBy(from);
        if (to == null || to.isZero()) {
            throw ValidationException.zeroAddress("to");
        }
        this.holder = to;
    }

    public Address getSeries() { return series; }
    public long getTicketId() { return ticketId; }
    public Address getHolder() { return holder; }
}
