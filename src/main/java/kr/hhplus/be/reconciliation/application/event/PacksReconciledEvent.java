package kr.hhplus.be.reconciliation.application.event;

import java.time.LocalDateTime;

/**
 * 스크랩 결과 반영 완료 이벤트
 *
 * - 반영 트랜잭션 커밋 후 처리
 * - 변경된 팩의 POS 동기화 트리거
 */
public record PacksReconciledEvent(
        String performanceId,
        int created,
        int delisted,
        int resynced,
        LocalDateTime reconciledAt
) {
    public boolean hasPosWork() {
        return created + delisted + resynced > 0;
    }
}
