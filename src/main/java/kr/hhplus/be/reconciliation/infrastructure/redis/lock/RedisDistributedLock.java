package kr.hhplus.be.reconciliation.infrastructure.redis.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Redis 기반 분산락 구현
 * - SETNX 로 락 획득
 * - 소유권 확인과 삭제는 Lua 스크립트로 한 번에 처리
 * - 공연 단위 반영 작업(스크랩 결과 반영)의 동시 실행 방지에 사용
 */
@Component
public class RedisDistributedLock {
    private static final String LOCK_PREFIX = "lock:reconciliation:performance:";

    public static String buildPerformanceLockKey(String performanceId) {
        return LOCK_PREFIX + performanceId;
    }

    private static final Logger log = LoggerFactory.getLogger(RedisDistributedLock.class);

    private static final DefaultRedisScript<Long> UNLOCK_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "  return redis.call('DEL', KEYS[1]) " +
            "else " +
            "  return 0 " +
            "end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;

    public RedisDistributedLock(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * 락을 획득하고 작업을 실행
     *
     * @param lockKey 락 키
     * @param ttlSeconds 락 유효 시간 (초)
     * @param retryCount 획득 시도 횟수
     * @param retryDelayMillis 재시도 대기 시간 (밀리초)
     * @param action 실행할 작업
     * @return 작업 결과
     * @throws LockAcquisitionException 시도 횟수 안에 락을 얻지 못한 경우
     */
    public <T> T executeWithLock(
            String lockKey,
            long ttlSeconds,
            int retryCount,
            long retryDelayMillis,
            Supplier<T> action
    ) {
        String lockValue = UUID.randomUUID().toString();
        int attempts = 0;

        while (attempts < retryCount) {
            if (tryLock(lockKey, lockValue, ttlSeconds)) {
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
                sleep(retryDelayMillis);
            }
        }

        throw LockAcquisitionException.of(lockKey, retryCount);
    }

    public boolean tryLock(String key, String value, long ttlSeconds) {
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key, value, Duration.ofSeconds(ttlSeconds));
        return Boolean.TRUE.equals(success);
    }

    /**
     * 락 해제 (내 락일 때만 삭제)
     */
    public boolean unlock(String key, String value) {
        Long deleted = redisTemplate.execute(UNLOCK_SCRIPT, List.of(key), value);
        return deleted != null && deleted > 0;
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
