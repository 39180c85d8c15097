package kr.hhplus.be.ticketing.application.service;

import kr.hhplus.be.ticketing.application.event.TicketingActivity;
import kr.hhplus.be.ticketing.application.port.in.ActivityQueryUseCase;
import kr.hhplus.be.ticketing.application.port.out.ActivityLogPort;
import kr.hhplus.be.ticketing.domain.common.Address;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ActivityQueryService implements ActivityQueryUseCase {

    private final ActivityLogPort activityLogPort;

    @Override
    @Transactional(readOnly = true)
    public List<TicketingActivity> recentActivities(Address subject, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        return activityLogPort.findRecentBySubject(subject, bounded);
    }
}
