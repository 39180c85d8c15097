package kr.hhplus.be.ticketing.application.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 커밋된 활동 기록을 구조화된 로그로 출력
 * - 커밋되지 않은(롤백된) 작업의 이벤트는 여기까지 오지 않는다
 */
@Slf4j
@Component
public class ActivityLogListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onActivity(TicketingActivity activity) {
        try {
            log.info("[Activity] type={} subject={} actor={} counterparty={} amount={} fee={} ticketId={} detail={} at={}",
                    activity.type(),
                    activity.subject(),
                    activity.actor(),
                    activity.counterparty(),
                    activity.amount(),
                    activity.fee(),
                    activity.ticketId(),
                    activity.detail(),
                    activity.occurredAt());
        } catch (Exception e) {
            log.warn("⚠️ [Activity] 활동 로그 출력 실패 (무시) - type: {}, error: {}",
                    activity.type(), e.getMessage());
        }
    }
}
