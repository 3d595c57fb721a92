package kr.hhplus.be.reconciliation.domain.seatpack;

import kr.hhplus.be.reconciliation.domain.common.Money;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.InvalidPackTransitionException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 좌석 팩 애그리게이트 루트
 * - 한 열의 연속 좌석 묶음 (POS 판매 단위)
 * - 4차원 상태: 운영 상태 / POS 상태 / 생애주기 상태 / 내림 사유
 * - 좌석 구성은 생성 이후 불변 (구성 변경은 기존 팩 내림 + 새 팩 생성으로 표현)
 * - 물리 삭제 없음: 비활성/변환된 팩은 계보 기록으로 남는다
 */
public class SeatPack {

    private final SeatPackId id;
    private final String source;
    private final PackLocation location;
    private final List<String> seatIds;
    private final String startSeat;
    private final String endSeat;
    private final boolean wheelchairAccessible;
    private final LocalDateTime createdAt;

    private Money seatPrice;
    private Money totalPrice;

    private PackStatus packStatus;
    private PosStatus posStatus;
    private PackState packState;
    private DelistReason delistReason;
    private List<String> sourcePackIds;

    // POS 동기화 기록
    private boolean syncedToPos;
    private int posSyncAttempts;
    private LocalDateTime lastPosSyncAttempt;
    private String posSyncError;
    private String posListingId;

    // 진행 중 POS 작업
    private String posOperationId;
    private PosOperationStatus posOperationStatus;

    // 수동 작업 감사 기록
    private boolean manuallyDelisted;
    private String manuallyDelistedBy;
    private LocalDateTime manuallyDelistedAt;
    private String manuallyDelistedReason;
    private String manuallyEnabledBy;
    private LocalDateTime manuallyEnabledAt;

    // 동시성 제어 (리스 필드는 저장소의 리스 연산으로만 변경된다)
    private final String lockedBy;
    private final LocalDateTime lockedAt;
    private final long version;

    private SeatPack(Snapshot s) {
        this.id = Objects.requireNonNull(s.id(), "팩 ID는 필수입니다");
        this.source = s.source();
        this.location = Objects.requireNonNull(s.location(), "팩 위치는 필수입니다");
        if (s.seatIds() == null || s.seatIds().isEmpty()) {
            throw new IllegalArgumentException("팩에는 최소 1개의 좌석이 필요합니다");
        }
        this.seatIds = List.copyOf(s.seatIds());
        this.startSeat = s.startSeat();
        this.endSeat = s.endSeat();
        this.wheelchairAccessible = s.wheelchairAccessible();
        this.createdAt = s.createdAt();
        this.seatPrice = s.seatPrice();
        this.totalPrice = s.totalPrice();
        this.packStatus = Objects.requireNonNull(s.packStatus(), "운영 상태는 필수입니다");
        this.posStatus = Objects.requireNonNull(s.posStatus(), "POS 상태는 필수입니다");
        this.packState = Objects.requireNonNull(s.packState(), "생애주기 상태는 필수입니다");
        this.delistReason = s.delistReason();
        this.sourcePackIds = s.sourcePackIds() == null ? List.of() : List.copyOf(s.sourcePackIds());
        this.syncedToPos = s.syncedToPos();
        this.posSyncAttempts = s.posSyncAttempts();
        this.lastPosSyncAttempt = s.lastPosSyncAttempt();
        this.posSyncError = s.posSyncError();
        this.posListingId = s.posListingId();
        this.posOperationId = s.posOperationId();
        this.posOperationStatus = s.posOperationStatus();
        this.manuallyDelisted = s.manuallyDelisted();
        this.manuallyDelistedBy = s.manuallyDelistedBy();
        this.manuallyDelistedAt = s.manuallyDelistedAt();
        this.manuallyDelistedReason = s.manuallyDelistedReason();
        this.manuallyEnabledBy = s.manuallyEnabledBy();
        this.manuallyEnabledAt = s.manuallyEnabledAt();
        this.lockedBy = s.lockedBy();
        this.lockedAt = s.lockedAt();
        this.version = s.version();
    }

    // === 팩토리 메서드들 ===

    /**
     * 비교 결과로 새 팩 생성 (POS 반영 대기 상태로 시작)
     */
    public static SeatPack create(CandidatePack candidate, PackState origin,
                                  List<String> sourcePackIds, LocalDateTime now) {
        Objects.requireNonNull(candidate, "후보 팩은 필수입니다");
        if (!origin.isOrigin()) {
            throw new IllegalArgumentException("생성 계열 상태만 지정할 수 있습니다: " + origin);
        }
        if (origin == PackState.CREATE && !sourcePackIds.isEmpty()) {
            throw new IllegalArgumentException("신규 팩은 원본 팩을 가질 수 없습니다");
        }
        if (origin != PackState.CREATE && sourcePackIds.isEmpty()) {
            throw new IllegalArgumentException("분할/병합/축소 팩은 원본 팩이 필요합니다");
        }

        SeatPack pack = new SeatPack(new Snapshot(
                candidate.id(), candidate.source(), candidate.location(), candidate.seatIds(),
                candidate.startSeat(), candidate.endSeat(), candidate.wheelchairAccessible(),
                candidate.seatPrice(), candidate.totalPrice(),
                PackStatus.ACTIVE, PosStatus.PENDING, origin, null, sourcePackIds,
                false, 0, null, null, null,
                null, null,
                false, null, null, null, null, null,
                null, null, 0L, now
        ));
        pack.assertInvariants();
        return pack;
    }

    /**
     * 기존 팩 복원 (Repository에서 사용)
     */
    public static SeatPack restore(Snapshot snapshot) {
        return new SeatPack(snapshot);
    }

    // === 비즈니스 메서드들 ===

    /**
     * 동일 좌석 구성이 다시 나타난 경우 기존 기록을 새 생애로 다시 연다.
     * 결정적 ID 특성상 같은 좌석 묶음은 같은 레코드를 공유한다.
     * 이전 생애의 원본 팩 ID는 지우지 않고 새 원본 팩 ID 앞에 남긴다.
     */
    public void reopen(CandidatePack candidate, PackState origin, List<String> newSourcePackIds) {
        if (packStatus != PackStatus.INACTIVE || !packState.canReopen()) {
            throw new InvalidPackTransitionException(id,
                    String.format("현재 상태[%s]에서는 다시 열 수 없습니다", packState.getDisplayName()));
        }
        if (isOperatorHeld()) {
            throw new InvalidPackTransitionException(id, "운영자가 내린 팩은 자동으로 다시 열 수 없습니다");
        }
        if (!origin.isOrigin()) {
            throw new IllegalArgumentException("생성 계열 상태만 지정할 수 있습니다: " + origin);
        }
        List<String> lineage = new ArrayList<>(sourcePackIds);
        newSourcePackIds.stream()
                .filter(sourceId -> !lineage.contains(sourceId) && !sourceId.equals(id.value()))
                .forEach(lineage::add);

        this.packStatus = PackStatus.ACTIVE;
        this.packState = origin;
        this.delistReason = null;
        this.sourcePackIds = List.copyOf(lineage);
        this.seatPrice = candidate.seatPrice();
        this.totalPrice = candidate.totalPrice();
        relist();
        assertInvariants();
    }

    /**
     * 좌석 일부가 새 팩으로 이어진 경우 (최종 상태)
     */
    public void transform() {
        changeState(PackState.TRANSFORMED);
        this.packStatus = PackStatus.INACTIVE;
        this.delistReason = DelistReason.TRANSFORMED;
        queueForSync();
        assertInvariants();
    }

    /**
     * 좌석이 모두 사라진 경우
     */
    public void vanish() {
        delist(DelistReason.VANISHED);
    }

    /**
     * 사유를 지정해 내림 처리 (POS 삭제 대기로 전환)
     */
    public void delist(DelistReason reason) {
        Objects.requireNonNull(reason, "내림 사유는 필수입니다");
        changeState(PackState.DELIST);
        this.packStatus = PackStatus.INACTIVE;
        this.delistReason = reason;
        queueForSync();
        assertInvariants();
    }

    /**
     * 운영자 수동 내림
     */
    public void manualDelist(String operator, String reason, LocalDateTime now) {
        if (!isManuallyDelistable()) {
            throw new InvalidPackTransitionException(id,
                    String.format("현재 상태[%s/%s]에서는 수동 내림을 할 수 없습니다",
                            packState.getDisplayName(), posStatus.getDisplayName()));
        }
        delist(DelistReason.MANUAL_DELIST);
        this.manuallyDelisted = true;
        this.manuallyDelistedBy = operator;
        this.manuallyDelistedAt = now;
        this.manuallyDelistedReason = reason;
    }

    /**
     * 수동 내림된 팩 재활성화 (DELIST → CREATE)
     */
    public void reactivate(String operator, LocalDateTime now) {
        if (!isManuallyReactivatable()) {
            throw new InvalidPackTransitionException(id, "수동으로 내린 팩만 재활성화할 수 있습니다");
        }
        changeState(PackState.CREATE);
        this.packStatus = PackStatus.ACTIVE;
        this.delistReason = null;
        this.manuallyDelisted = false;
        this.manuallyEnabledBy = operator;
        this.manuallyEnabledAt = now;
        relist();
        assertInvariants();
    }

    /**
     * 관리자 홀드 적용 완료 (POS 리스팅은 남아 있지만 판매 중지)
     */
    public void markAdminHeld(LocalDateTime now) {
        changeState(PackState.DELIST);
        this.packStatus = PackStatus.INACTIVE;
        this.delistReason = DelistReason.ADMIN_HOLD;
        this.posStatus = posListingId == null ? PosStatus.INACTIVE : PosStatus.SUSPENDED;
        this.syncedToPos = true;
        this.lastPosSyncAttempt = now;
        this.posSyncError = null;
        assertInvariants();
    }

    /**
     * 가격만 바뀐 경우 (좌석 구성 동일)
     */
    public void updatePrice(Money newSeatPrice, Money newTotalPrice) {
        if (packStatus != PackStatus.ACTIVE) {
            throw new InvalidPackTransitionException(id, "비활성 팩의 가격은 변경할 수 없습니다");
        }
        this.seatPrice = newSeatPrice;
        this.totalPrice = newTotalPrice;
    }

    /**
     * 새 동기화 작업으로 큐에 넣는다 (POS 상태는 대기, 시도 횟수 초기화)
     */
    public void queueForSync() {
        if (posStatus == PosStatus.SUSPENDED) {
            return;
        }
        this.posStatus = PosStatus.PENDING;
        this.syncedToPos = false;
        this.posSyncAttempts = 0;
        this.posSyncError = null;
    }

    /**
     * 재시도 한도를 초과한 팩을 운영자가 다시 큐에 넣는다
     */
    public void requeue() {
        if (syncedToPos) {
            throw new InvalidPackTransitionException(id, "이미 POS 와 동기화된 팩입니다");
        }
        queueForSync();
    }

    /**
     * POS 상태는 그대로 두고 동기화 대상에서만 제외한다 (처리할 작업이 없는 경우)
     */
    public void markNothingToSync() {
        this.syncedToPos = true;
    }

    // === POS 작업 추적 ===

    public void startPosOperation(String operationId, LocalDateTime now) {
        this.posOperationId = Objects.requireNonNull(operationId, "작업 ID는 필수입니다");
        this.posOperationStatus = PosOperationStatus.STARTED;
        this.lastPosSyncAttempt = now;
    }

    /**
     * POS 리스팅 생성 성공
     */
    public void markPushed(String listingId, LocalDateTime now) {
        if (packStatus != PackStatus.ACTIVE) {
            throw new InvalidPackTransitionException(id, "비활성 팩은 POS 에 올릴 수 없습니다");
        }
        this.posListingId = Objects.requireNonNull(listingId, "POS 리스팅 ID는 필수입니다");
        this.posStatus = PosStatus.ACTIVE;
        this.syncedToPos = true;
        this.posSyncError = null;
        this.lastPosSyncAttempt = now;
        completeOperation();
        assertInvariants();
    }

    /**
     * POS 리스팅 제거 완료 (이미 없던 경우 포함)
     */
    public void markDelisted(LocalDateTime now) {
        this.posStatus = PosStatus.INACTIVE;
        this.syncedToPos = true;
        this.posSyncError = null;
        this.lastPosSyncAttempt = now;
        completeOperation();
        assertInvariants();
    }

    /**
     * POS 반영 실패 - 시도 횟수 증가, 다음 주기에 재시도
     */
    public void markSyncFailed(String error, LocalDateTime now) {
        this.posSyncAttempts++;
        this.posSyncError = error;
        this.lastPosSyncAttempt = now;
        this.posStatus = PosStatus.FAILED;
        this.syncedToPos = false;
        this.posOperationStatus = posOperationId == null ? null : PosOperationStatus.FAILED;
        assertInvariants();
    }

    /**
     * 다시 판매 상태로 돌릴 때 POS 처리
     * 내림이 아직 POS 에 반영되지 않았으면 기존 리스팅을 그대로 살리고, 아니면 새로 올린다.
     */
    private void relist() {
        if (posListingId != null && posStatus != PosStatus.INACTIVE) {
            this.posStatus = PosStatus.ACTIVE;
            this.syncedToPos = true;
            this.posSyncAttempts = 0;
            this.posSyncError = null;
            return;
        }
        this.posListingId = null;
        queueForSync();
    }

    private void completeOperation() {
        this.posOperationStatus = posOperationId == null ? null : PosOperationStatus.COMPLETED;
        this.posOperationId = null;
    }

    // === 조회 메서드들 ===

    /**
     * POS 에 올려야 하는 팩: 생성 계열 + 활성 + 대기/실패
     */
    public boolean needsPush() {
        return packState.isOrigin()
                && packStatus == PackStatus.ACTIVE
                && posStatus.awaitsSync()
                && !syncedToPos;
    }

    /**
     * POS 에서 내려야 하는 팩: 내림 계열 + 대기/실패
     */
    public boolean needsDelist() {
        return packState.isDelisted()
                && posStatus.awaitsSync()
                && !syncedToPos;
    }

    public boolean isRetryExhausted(int maxAttempts) {
        return posStatus == PosStatus.FAILED && posSyncAttempts >= maxAttempts;
    }

    public boolean isManuallyDelistable() {
        return packStatus == PackStatus.ACTIVE
                && (posStatus == PosStatus.ACTIVE || posStatus == PosStatus.PENDING)
                && packState.isOrigin();
    }

    public boolean isManuallyReactivatable() {
        return packStatus == PackStatus.INACTIVE
                && packState == PackState.DELIST
                && delistReason == DelistReason.MANUAL_DELIST;
    }

    public boolean isOperatorHeld() {
        return manuallyDelisted || (delistReason != null && delistReason.isOperatorHold());
    }

    public boolean isListed() {
        return posListingId != null;
    }

    public boolean isActive() {
        return packStatus == PackStatus.ACTIVE;
    }

    /**
     * 상태 불변식 검증
     * - TRANSFORMED ⇒ INACTIVE
     * - DELIST/TRANSFORMED ⇒ 내림 사유 존재
     * - INACTIVE ⇒ POS 상태가 ACTIVE 가 아님
     */
    public void assertInvariants() {
        if (packState == PackState.TRANSFORMED && packStatus != PackStatus.INACTIVE) {
            throw new IllegalStateException("변환된 팩은 비활성이어야 합니다: " + id);
        }
        if (packState.isDelisted() && delistReason == null) {
            throw new IllegalStateException("내림 상태의 팩에는 사유가 필요합니다: " + id);
        }
        if (packStatus == PackStatus.INACTIVE && posStatus == PosStatus.ACTIVE) {
            throw new IllegalStateException("비활성 팩이 POS 에 판매중일 수 없습니다: " + id);
        }
    }

    private void changeState(PackState target) {
        if (!packState.canTransitionTo(target)) {
            throw new InvalidPackTransitionException(id,
                    String.format("상태 전환 불가: %s → %s", packState.getDisplayName(), target.getDisplayName()));
        }
        this.packState = target;
    }

    /**
     * 저장용 스냅샷
     */
    public Snapshot snapshot() {
        return new Snapshot(id, source, location, seatIds, startSeat, endSeat, wheelchairAccessible,
                seatPrice, totalPrice, packStatus, posStatus, packState, delistReason, sourcePackIds,
                syncedToPos, posSyncAttempts, lastPosSyncAttempt, posSyncError, posListingId,
                posOperationId, posOperationStatus,
                manuallyDelisted, manuallyDelistedBy, manuallyDelistedAt, manuallyDelistedReason,
                manuallyEnabledBy, manuallyEnabledAt,
                lockedBy, lockedAt, version, createdAt);
    }

    // === Getters ===
    public SeatPackId getId() { return id; }
    public String getSource() { return source; }
    public PackLocation getLocation() { return location; }
    public String getPerformanceId() { return location.performanceId(); }
    public List<String> getSeatIds() { return seatIds; }
    public String getStartSeat() { return startSeat; }
    public String getEndSeat() { return endSeat; }
    public int getPackSize() { return seatIds.size(); }
    public boolean isWheelchairAccessible() { return wheelchairAccessible; }
    public Money getSeatPrice() { return seatPrice; }
    public Money getTotalPrice() { return totalPrice; }
    public PackStatus getPackStatus() { return packStatus; }
    public PosStatus getPosStatus() { return posStatus; }
    public PackState getPackState() { return packState; }
    public DelistReason getDelistReason() { return delistReason; }
    public List<String> getSourcePackIds() { return sourcePackIds; }
    public boolean isSyncedToPos() { return syncedToPos; }
    public int getPosSyncAttempts() { return posSyncAttempts; }
    public LocalDateTime getLastPosSyncAttempt() { return lastPosSyncAttempt; }
    public String getPosSyncError() { return posSyncError; }
    public String getPosListingId() { return posListingId; }
    public String getPosOperationId() { return posOperationId; }
    public PosOperationStatus getPosOperationStatus() { return posOperationStatus; }
    public boolean isManuallyDelisted() { return manuallyDelisted; }
    public String getManuallyDelistedBy() { return manuallyDelistedBy; }
    public LocalDateTime getManuallyDelistedAt() { return manuallyDelistedAt; }
    public String getManuallyDelistedReason() { return manuallyDelistedReason; }
    public String getManuallyEnabledBy() { return manuallyEnabledBy; }
    public LocalDateTime getManuallyEnabledAt() { return manuallyEnabledAt; }
    public String getLockedBy() { return lockedBy; }
    public LocalDateTime getLockedAt() { return lockedAt; }
    public long getVersion() { return version; }
    public LocalDateTime getCreatedAt() { return createdAt; }

    // === Object methods ===

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        SeatPack that = (SeatPack) obj;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return String.format("SeatPack{id=%s, %s, seats=%s-%s(%d), status=%s/%s/%s}",
                id.value(), location.toDisplayString(), startSeat, endSeat, seatIds.size(),
                packStatus, posStatus, packState);
    }

    /**
     * 팩의 전체 상태를 담는 불변 스냅샷 (저장소 ↔ 도메인 변환용)
     */
    public record Snapshot(
            SeatPackId id,
            String source,
            PackLocation location,
            List<String> seatIds,
            String startSeat,
            String endSeat,
            boolean wheelchairAccessible,
            Money seatPrice,
            Money totalPrice,
            PackStatus packStatus,
            PosStatus posStatus,
            PackState packState,
            DelistReason delistReason,
            List<String> sourcePackIds,
            boolean syncedToPos,
            int posSyncAttempts,
            LocalDateTime lastPosSyncAttempt,
            String posSyncError,
            String posListingId,
            String posOperationId,
            PosOperationStatus posOperationStatus,
            boolean manuallyDelisted,
            String manuallyDelistedBy,
            LocalDateTime manuallyDelistedAt,
            String manuallyDelistedReason,
            String manuallyEnabledBy,
            LocalDateTime manuallyEnabledAt,
            String lockedBy,
            LocalDateTime lockedAt,
            long version,
            LocalDateTime createdAt
    ) {
    }
}
