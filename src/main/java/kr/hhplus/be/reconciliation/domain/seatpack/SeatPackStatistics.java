package kr.hhplus.be.reconciliation.domain.seatpack;

import java.io.Serializable;

/**
 * 팩 저장소 집계 값
 */
public record SeatPackStatistics(
        long total,
        long active,
        long inactive,
        long posPending,
        long posFailed,
        long unsynced,
        long pendingCreation,
        long pendingDelisting,
        long highRetry,
        long activeLeases,
        long staleLeases,
        long inFlightOperations,
        long failedOperations
) implements Serializable {
}
