package kr.hhplus.be.reconciliation.application.sync;

/**
 * 앞 단계를 되돌리는 보상 작업
 *
 * @param actionType 보상 작업 유형 (예: delete_pos_listing)
 * @param actionData 수동 처리에 필요한 정보
 */
public record CompensatingAction(String actionType, String actionData, Compensation compensation) {

    @FunctionalInterface
    public interface Compensation {
        void run() throws Exception;
    }
}
