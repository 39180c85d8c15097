package kr.hhplus.be.ticketing.application.port.out;

import java.util.function.Supplier;

/**
 * 상태 변경 작업 직렬화용 락
 */
public interface LedgerLockPort {

    <T> T executeWithLock(String lockKey, Supplier<T> action);
}
