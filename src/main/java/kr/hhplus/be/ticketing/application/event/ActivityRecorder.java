package kr.hhplus.be.ticketing.application.event;

import kr.hhplus.be.ticketing.application.port.out.ActivityLogPort;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 활동 기록 저장 + 애플리케이션 이벤트 발행
 * - 반드시 작업 트랜잭션 안에서 호출한다 (롤백 시 기록도 함께 사라짐)
 */
@Component
@RequiredArgsConstructor
public class ActivityRecorder {

    private final ActivityLogPort activityLogPort;
    private final ApplicationEventPublisher eventPublisher;

    public void record(TicketingActivity activity) {
        activityLogPort.save(activity);
        eventPublisher.publishEvent(activity);
    }
}
