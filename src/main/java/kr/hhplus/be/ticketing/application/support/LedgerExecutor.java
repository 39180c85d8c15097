package kr.hhplus.be.ticketing.application.support;

import kr.hhplus.be.ticketing.application.port.out.LedgerLockPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 모든 상태 변경 작업의 실행 경계
 *
 * [실행 순서]
 * - 원장 락 획득 → 트랜잭션 시작 → 작업 → 커밋/롤백 → 락 해제
 * - 작업 중 다른 유스케이스를 호출하면(조직 → 레지스트리 등) 같은 락/트랜잭션 안에서 실행되어
 *   전체가 하나의 단위로 커밋되거나 롤백된다
 */
@Component
@RequiredArgsConstructor
public class LedgerExecutor {

    static final String LEDGER_LOCK_KEY = "lock:ticketing:ledger";

    private static final ThreadLocal<Boolean> INSIDE = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private final LedgerLockPort ledgerLock;
    private final TransactionTemplate transactionTemplate;

    public <T> T execute(Supplier<T> action) {
        if (INSIDE.get()) {
            // 바깥 작업의 일부로 실행
            return action.get();
        }
        return ledgerLock.executeWithLock(LEDGER_LOCK_KEY, () -> {
            INSIDE.set(Boolean.TRUE);
            try {
                return transactionTemplate.execute(status -> action.get());
            } finally {
                INSIDE.remove();
            }
        });
    }

    public void run(Runnable action) {
        execute(() -> {
            action.run();
            return null;
        });
    }
}
