package kr.hhplus.be.reconciliation.domain.seatpack;

/**
 * 진행 중인 POS 작업 추적 상태 (작업 도중 종료된 프로세스 감지용)
 */
public enum PosOperationStatus {
    STARTED,
    COMPLETED,
    FAILED
}
