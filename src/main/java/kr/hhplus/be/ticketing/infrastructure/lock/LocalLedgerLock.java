package kr.hhplus.be.ticketing.infrastructure.lock;

import kr.hhplus.be.ticketing.application.port.out.LedgerLockPort;
import kr.hhplus.be.ticketing.infrastructure.config.TicketingProperties;
import kr.hhplus.be.ticketing.infrastructure.redis.lock.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 단일 인스턴스용 원장 락 (기본값)
 * - 키별 공정(fair) ReentrantLock
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "ticketing.lock.type", havingValue = "local", matchIfMissing = true)
public class LocalLedgerLock implements LedgerLockPort {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final long waitMillis;

    public LocalLedgerLock(TicketingProperties properties) {
        this.waitMillis = properties.getLock().getWaitMillis();
    }

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(lockKey, key -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 대기 중 인터럽트 발생", e);
        }
        if (!acquired) {
            throw LockAcquisitionException.timeout(lockKey, waitMillis);
        }

        try {
            log.debug("락 획득 성공: key={}", lockKey);
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
