package kr.hhplus.be.ticketing.application.port.in;

import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.domain.common.Address;

import java.util.List;

public interface ActivityQueryUseCase {

    int MAX_LIMIT = 100;

    List<TicketingActivity> recentActivities(Address subject, int limit);
}
