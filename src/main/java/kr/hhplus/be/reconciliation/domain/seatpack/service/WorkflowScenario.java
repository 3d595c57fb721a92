package kr.hhplus.be.reconciliation.domain.seatpack.service;

/**
 * 스크랩 주기 시나리오
 */
public enum WorkflowScenario {

    INITIAL_SCRAPE("최초 스크랩"),
    SUBSEQUENT_SCRAPE("후속 스크랩");

    private final String displayName;

    WorkflowScenario(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    // 활성 팩이 하나도 없으면 최초 스크랩으로 본다
    public static WorkflowScenario determine(int activePackCount) {
        return activePackCount == 0 ? INITIAL_SCRAPE : SUBSEQUENT_SCRAPE;
    }
}
