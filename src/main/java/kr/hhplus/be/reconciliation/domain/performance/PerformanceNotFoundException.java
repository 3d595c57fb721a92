package kr.hhplus.be.reconciliation.domain.performance;

public class PerformanceNotFoundException extends RuntimeException {

    public PerformanceNotFoundException(String performanceId) {
        super("공연을 찾을 수 없습니다: " + performanceId);
    }
}
