package kr.hhplus.be.reconciliation.application.sync;

import kr.hhplus.be.reconciliation.domain.rollback.FailedRollback;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RollbackStackTest {

    @Mock
    private FailedRollbackRepository failedRollbackRepository;

    @Test
    @DisplayName("보상 작업은 쌓인 역순으로 실행된다")
    void unwind_reverseOrder() {
        // given
        List<String> executed = new ArrayList<>();
        RollbackStack stack = new RollbackStack("op-1", "tm_pk_1", failedRollbackRepository);
        stack.push(new CompensatingAction("first", null, () -> executed.add("first")));
        stack.push(new CompensatingAction("second", null, () -> executed.add("second")));
        stack.push(new CompensatingAction("third", null, () -> executed.add("third")));

        // when
        RollbackStack.UnwindReport report = stack.unwind();

        // then
        assertThat(executed).containsExactly("third", "second", "first");
        assertThat(report.executed()).isEqualTo(3);
        assertThat(report.failed()).isZero();
        assertThat(stack.size()).isZero();
        verifyNoInteractions(failedRollbackRepository);
    }

    @Test
    @DisplayName("실패한 보상 작업은 기록하고 나머지는 계속 실행한다")
    void failedCompensation_recordedAndContinues() {
        List<String> executed = new ArrayList<>();
        RollbackStack stack = new RollbackStack("op-1", "tm_pk_1", failedRollbackRepository);
        stack.push(new CompensatingAction("first", null, () -> executed.add("first")));
        stack.push(new CompensatingAction("delete_pos_listing", "listingId=L-1", () -> {
            throw new IllegalStateException("timeout");
        }));

        RollbackStack.UnwindReport report = stack.unwind();

        assertThat(executed).containsExactly("first");
        assertThat(report.executed()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);

        ArgumentCaptor<FailedRollback> captor = ArgumentCaptor.forClass(FailedRollback.class);
        verify(failedRollbackRepository).append(captor.capture());
        assertThat(captor.getValue().getActionType()).isEqualTo("delete_pos_listing");
        assertThat(captor.getValue().getActionData()).isEqualTo("listingId=L-1");
        assertThat(captor.getValue().getErrorMessage()).isEqualTo("timeout");
    }

    @Test
    @DisplayName("실패 기록 저장마저 실패해도 예외를 밖으로 던지지 않는다")
    void recordFailure_doesNotPropagate() {
        when(failedRollbackRepository.append(any())).thenThrow(new IllegalStateException("db down"));
        RollbackStack stack = new RollbackStack("op-1", "tm_pk_1", failedRollbackRepository);
        stack.push(new CompensatingAction("delete_pos_listing", "listingId=L-1", () -> {
            throw new IllegalStateException("timeout");
        }));

        RollbackStack.UnwindReport report = stack.unwind();

        assertThat(report.failed()).isEqualTo(1);
    }
}
