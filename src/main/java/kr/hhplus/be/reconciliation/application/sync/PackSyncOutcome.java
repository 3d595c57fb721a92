package kr.hhplus.be.reconciliation.application.sync;

/**
 * 팩 하나의 POS 동기화 처리 결과
 */
public enum PackSyncOutcome {

    PUSHED(Category.SYNCED),
    DELISTED(Category.SYNCED),
    FAILED(Category.FAILED),
    VALIDATION_FAILED(Category.FAILED),
    SKIPPED(Category.SKIPPED),
    LEASE_CONFLICT(Category.SKIPPED),
    NOTHING_TO_DO(Category.SKIPPED);

    public enum Category {
        SYNCED,
        FAILED,
        SKIPPED
    }

    private final Category category;

    PackSyncOutcome(Category category) {
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }
}
