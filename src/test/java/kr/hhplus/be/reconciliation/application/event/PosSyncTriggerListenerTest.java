package kr.hhplus.be.reconciliation.application.event;

import kr.hhplus.be.reconciliation.application.port.in.PosSyncUseCase;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PosSyncTriggerListenerTest {

    @Mock
    private PosSyncUseCase posSyncUseCase;

    private final ReconciliationProperties properties = new ReconciliationProperties();

    @Test
    @DisplayName("POS 작업이 있으면 해당 공연만 동기화한다")
    void triggersSync() {
        PosSyncTriggerListener listener = new PosSyncTriggerListener(posSyncUseCase, properties);
        when(posSyncUseCase.syncPendingPacks("perf-1")).thenReturn(new PosSyncUseCase.PosSyncResult(
                true, "op", "perf-1", 1, 1, 0, 0, 0.1, List.of()));

        listener.syncAfterReconcile(new PacksReconciledEvent("perf-1", 1, 0, 0, LocalDateTime.now()));

        verify(posSyncUseCase).syncPendingPacks("perf-1");
    }

    @Test
    @DisplayName("변경이 없거나 자동 동기화가 꺼져 있으면 호출하지 않는다")
    void skips() {
        PosSyncTriggerListener listener = new PosSyncTriggerListener(posSyncUseCase, properties);
        listener.syncAfterReconcile(new PacksReconciledEvent("perf-1", 0, 0, 0, LocalDateTime.now()));

        properties.getSync().setAutoSyncAfterReconcile(false);
        listener.syncAfterReconcile(new PacksReconciledEvent("perf-1", 3, 0, 0, LocalDateTime.now()));

        verifyNoInteractions(posSyncUseCase);
    }

    @Test
    @DisplayName("동기화 중 예외는 밖으로 전파하지 않는다")
    void swallowsFailureWithLog() {
        PosSyncTriggerListener listener = new PosSyncTriggerListener(posSyncUseCase, properties);
        when(posSyncUseCase.syncPendingPacks("perf-1")).thenThrow(new IllegalStateException("boom"));

        assertThatCode(() -> listener.syncAfterReconcile(
                new PacksReconciledEvent("perf-1", 1, 0, 0, LocalDateTime.now())))
                .doesNotThrowAnyException();
    }
}
