package kr.hhplus.be.reconciliation.application.sync;

import kr.hhplus.be.reconciliation.domain.rollback.FailedRollback;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 다단계 작업의 보상 작업 스택 (작업 하나당 인스턴스 하나)
 *
 * 단계가 성공할 때마다 보상 작업을 쌓고, 이후 단계가 실패하면 역순으로 실행한다.
 * 보상 작업 자체가 실패하면 재시도하지 않고 롤백 실패 로그에 남긴다.
 */
@Slf4j
public class RollbackStack {

    private final String operationId;
    private final String packId;
    private final FailedRollbackRepository failedRollbackRepository;
    private final Deque<CompensatingAction> actions = new ArrayDeque<>();

    public RollbackStack(String operationId, String packId, FailedRollbackRepository failedRollbackRepository) {
        this.operationId = operationId;
        this.packId = packId;
        this.failedRollbackRepository = failedRollbackRepository;
    }

    public void push(CompensatingAction action) {
        actions.push(action);
    }

    public int size() {
        return actions.size();
    }

    /**
     * 쌓인 보상 작업을 역순으로 실행
     */
    public UnwindReport unwind() {
        int executed = 0;
        int failed = 0;
        while (!actions.isEmpty()) {
            CompensatingAction action = actions.pop();
            try {
                action.compensation().run();
                executed++;
                log.info("[롤백] 보상 작업 완료 - operationId: {}, packId: {}, action: {}",
                        operationId, packId, action.actionType());
            } catch (Exception e) {
                failed++;
                log.error("[롤백] 보상 작업 실패 - operationId: {}, packId: {}, action: {}, data: {}",
                        operationId, packId, action.actionType(), action.actionData(), e);
                recordFailure(action, e);
            }
        }
        return new UnwindReport(executed, failed);
    }

    private void recordFailure(CompensatingAction action, Exception cause) {
        try {
            failedRollbackRepository.append(FailedRollback.record(
                    operationId, packId, action.actionType(), action.actionData(),
                    cause.getMessage(), LocalDateTime.now()));
        } catch (RuntimeException e) {
            // 기록마저 실패하면 로그가 유일한 흔적이다
            log.error("[롤백] 롤백 실패 기록 저장 실패 - operationId: {}, packId: {}, action: {}, data: {}",
                    operationId, packId, action.actionType(), action.actionData(), e);
        }
    }

    public record UnwindReport(int executed, int failed) {
    }
}
