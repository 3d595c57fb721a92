package kr.hhplus.be.reconciliation.infrastructure.redis.lock;

/**
 * 분산락 획득 실패 (같은 공연의 반영 작업이 이미 진행 중)
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static LockAcquisitionException of(String lockKey, int maxRetries) {
        return new LockAcquisitionException(
                String.format("락 획득 실패: key = %s, 최대 시도 횟수 %d 초과", lockKey, maxRetries)
        );
    }
}
