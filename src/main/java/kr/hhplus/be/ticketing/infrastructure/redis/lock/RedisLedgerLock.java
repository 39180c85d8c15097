package kr.hhplus.be.ticketing.infrastructure.redis.lock;

import kr.hhplus.be.ticketing.application.port.out.LedgerLockPort;
import kr.hhplus.be.ticketing.infrastructure.config.TicketingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis 기반 원장 락 (여러 인스턴스 배포용)
 * - SETNX + TTL 로 락 획득
 * - 소유자 값 확인 후 해제
 * - 고정 간격 재시도
 */
@Component
@ConditionalOnProperty(name = "ticketing.lock.type", havingValue = "redis")
public class RedisLedgerLock implements LedgerLockPort {

    private static final Logger log = LoggerFactory.getLogger(RedisLedgerLock.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final TicketingProperties.LockConfig config;

    public RedisLedgerLock(RedisTemplate<String, String> redisTemplate, TicketingProperties properties) {
        this.redisTemplate = redisTemplate;
        this.config = properties.getLock();
    }

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> action) {
        String lockValue = UUID.randomUUID().toString();
        int retryCount = config.getRetryCount();
        int attempts = 0;

        while (attempts < retryCount) {
            if (tryLock(lockKey, lockValue, config.getTtlSeconds())) {
                try {
                    log.debug("락 획득 성공: key={}, value={}", lockKey, lockValue);
                    return action.get();
                } finally {
                    if (unlock(lockKey, lockValue)) {
                        log.debug("락 해제 성공: key={}", lockKey);
                    } else {
                        log.warn("락 해제 실패: key={} (이미 만료되었거나 다른 소유자)", lockKey);
                    }
                }
            }

            attempts++;
            if (attempts < retryCount) {
                log.debug("락 획득 실패, 재시도 {}/{}: key={}", attempts, retryCount, lockKey);
                sleep(config.getRetryDelayMillis());
            }
        }

        throw LockAcquisitionException.of(lockKey, retryCount);
    }

    boolean tryLock(String key, String value, long ttlSeconds) {
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key, value, Duration.ofSeconds(ttlSeconds));
        return Boolean.TRUE.equals(success);
    }

    boolean unlock(String key, String value) {
        String currentValue = redisTemplate.opsForValue().get(key);
        if (value.equals(currentValue)) {
            redisTemplate.delete(key);
            return true;
        }
        return false;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 대기 중 인터럽트 발생", e);
        }
    }
}
