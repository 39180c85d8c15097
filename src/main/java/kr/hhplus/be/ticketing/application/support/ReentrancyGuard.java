package kr.hhplus.be.ticketing.application.support;

import kr.hhplus.be.ticketing.domain.common.exception.StateException;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 잔액 조회 → 이체 구간의 재진입 차단
 * - 외부 토큰이 이체 도중 같은 출금 작업을 다시 호출하면 실패시킨다
 */
@Component
public class ReentrancyGuard {

    private final Set<String> entered = ConcurrentHashMap.newKeySet();

    public <T> T guard(String key, Supplier<T> action) {
        if (!entered.add(key)) {
            throw new StateException("재진입 호출이 감지되었습니다: " + key);
        }
        try {
            return action.get();
        } finally {
            entered.remove(key);
        }
    }
}
