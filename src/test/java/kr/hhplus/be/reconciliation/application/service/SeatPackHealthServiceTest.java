package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.port.in.PackHealthUseCase.FailedRollbackView;
import kr.hhplus.be.reconciliation.application.port.in.PackHealthUseCase.HealthStatus;
import kr.hhplus.be.reconciliation.application.port.in.PackHealthUseCase.SeatPackHealth;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollback;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackNotFoundException;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPackStatistics;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SeatPackHealthServiceTest {

    @Mock private SeatPackRepository seatPackRepository;
    @Mock private FailedRollbackRepository failedRollbackRepository;

    private SeatPackHealthService service;

    @BeforeEach
    void setUp() {
        service = new SeatPackHealthService(seatPackRepository, failedRollbackRepository, new ReconciliationProperties());
    }

    private static SeatPackStatistics stats(long posFailed, long unsynced, long staleLeases) {
        return new SeatPackStatistics(100, 80, 20, 5, posFailed, unsynced, 3, 2, 1, 4, staleLeases, 1, 0);
    }

    @Test
    @DisplayName("문제가 없으면 HEALTHY")
    void healthy() {
        when(seatPackRepository.statistics(any(), eq(3))).thenReturn(stats(0, 10, 0));
        when(failedRollbackRepository.countUnresolved()).thenReturn(0L);

        SeatPackHealth health = service.checkHealth();

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.issues()).isEmpty();
    }

    @Test
    @DisplayName("오래된 리스 10개 초과 또는 미동기화 1000개 초과는 WARNING")
    void warning() {
        when(seatPackRepository.statistics(any(), anyInt())).thenReturn(stats(0, 1001, 11));
        when(failedRollbackRepository.countUnresolved()).thenReturn(0L);

        SeatPackHealth health = service.checkHealth();

        assertThat(health.status()).isEqualTo(HealthStatus.WARNING);
        assertThat(health.issues()).hasSize(2);
    }

    @Test
    @DisplayName("처리되지 않은 롤백 실패가 하나라도 있으면 CRITICAL")
    void unresolvedRollback_critical() {
        when(seatPackRepository.statistics(any(), anyInt())).thenReturn(stats(0, 0, 0));
        when(failedRollbackRepository.countUnresolved()).thenReturn(1L);

        SeatPackHealth health = service.checkHealth();

        assertThat(health.status()).isEqualTo(HealthStatus.CRITICAL);
        assertThat(health.unresolvedFailedRollbacks()).isEqualTo(1);
    }

    @Test
    @DisplayName("오래된 리스 50개 초과는 CRITICAL")
    void staleLeases_critical() {
        when(seatPackRepository.statistics(any(), anyInt())).thenReturn(stats(0, 0, 51));
        when(failedRollbackRepository.countUnresolved()).thenReturn(0L);

        assertThat(service.checkHealth().status()).isEqualTo(HealthStatus.CRITICAL);
    }

    @Test
    @DisplayName("롤백 실패 기록을 처리자와 메모로 해결 처리한다")
    void resolveRollback() {
        FailedRollback failed = FailedRollback.restore(7L, "op-1", "tm_pk_1", "delete_pos_listing",
                "listingId=L-1", "timeout", LocalDateTime.now().minusHours(1), null, null, null);
        when(failedRollbackRepository.findById(7L)).thenReturn(Optional.of(failed));
        when(failedRollbackRepository.markResolved(any())).thenAnswer(inv -> inv.getArgument(0));

        FailedRollbackView view = service.resolveRollback(7L, "kim", "POS 에서 직접 삭제함");

        assertThat(view.resolvedBy()).isEqualTo("kim");
        assertThat(view.resolutionNotes()).isEqualTo("POS 에서 직접 삭제함");
        assertThat(view.resolvedAt()).isNotNull();
    }

    @Test
    @DisplayName("이미 처리된 기록은 다시 처리할 수 없다")
    void resolveTwice_rejected() {
        FailedRollback resolved = FailedRollback.restore(7L, "op-1", "tm_pk_1", "delete_pos_listing",
                null, "timeout", LocalDateTime.now().minusHours(1), LocalDateTime.now(), "kim", null);
        when(failedRollbackRepository.findById(7L)).thenReturn(Optional.of(resolved));

        assertThatThrownBy(() -> service.resolveRollback(7L, "lee", null))
                .isInstanceOf(IllegalStateException.class);
        verify(failedRollbackRepository, never()).markResolved(any());
    }

    @Test
    @DisplayName("없는 기록은 찾을 수 없음 예외")
    void resolveMissing() {
        when(failedRollbackRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.resolveRollback(99L, "kim", null))
                .isInstanceOf(FailedRollbackNotFoundException.class);
    }
}
