package kr.hhplus.be.ticketing.application.port.out;

import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.domain.common.Address;

import java.util.List;

public interface ActivityLogPort {

    void save(TicketingActivity activity);

    List<TicketingActivity> findRecentBySubject(Address subject, int limit);
}
