package kr.hhplus.be.reconciliation.application.service;

import kr.hhplus.be.reconciliation.application.port.out.PosApiPort;
import kr.hhplus.be.reconciliation.application.port.out.PosCreateResult;
import kr.hhplus.be.reconciliation.application.port.out.PosDeleteResult;
import kr.hhplus.be.reconciliation.application.port.out.PosListingPayload;
import kr.hhplus.be.reconciliation.application.sync.PackSyncOutcome;
import kr.hhplus.be.reconciliation.application.sync.PosPackValidator;
import kr.hhplus.be.reconciliation.application.sync.PosPayloadFactory;
import kr.hhplus.be.reconciliation.domain.performance.Performance;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollback;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackRepository;
import kr.hhplus.be.reconciliation.domain.seatpack.DelistReason;
import kr.hhplus.be.reconciliation.domain.seatpack.PackState;
import kr.hhplus.be.reconciliation.domain.seatpack.PosStatus;
import kr.hhplus.be.reconciliation.domain.seatpack.SeatPack;
import kr.hhplus.be.reconciliation.infrastructure.config.ReconciliationProperties;
import kr.hhplus.be.reconciliation.support.InMemorySeatPackRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static kr.hhplus.be.reconciliation.support.SeatPackFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PackSyncProcessorTest {

    private static final String OPERATION_ID = "4f1c2a7e-0000-0000-0000-000000000000";

    @Mock private PosApiPort posApiPort;
    @Mock private FailedRollbackRepository failedRollbackRepository;

    private InMemorySeatPackRepository repository;
    private PackSyncProcessor processor;
    private Map<String, Performance> performances;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getLease().setOptimisticBaseDelayMs(1);

        repository = new InMemorySeatPackRepository();
        PackLeaseManager leaseManager = new PackLeaseManager(repository, properties);
        processor = new PackSyncProcessor(leaseManager, posApiPort, new PosPackValidator(),
                new PosPayloadFactory(properties), failedRollbackRepository, properties);
        performances = Map.of(PERFORMANCE_ID, performance());
    }

    private SeatPack stored(SeatPack pack) {
        return repository.save(pack);
    }

    @Nested
    @DisplayName("리스팅 생성")
    class Push {

        @Test
        @DisplayName("검증을 통과한 팩은 리스팅을 만들고 판매중으로 기록한다")
        void push_success() {
            // given
            SeatPack pack = stored(activePack("A", "1", "2", "3"));
            when(posApiPort.createListing(any())).thenReturn(PosCreateResult.created("L-100"));

            // when
            PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, performances);

            // then
            assertThat(outcome).isEqualTo(PackSyncOutcome.PUSHED);
            SeatPack saved = repository.get(pack.getId());
            assertThat(saved.getPosListingId()).isEqualTo("L-100");
            assertThat(saved.getPosStatus()).isEqualTo(PosStatus.ACTIVE);
            assertThat(saved.isSyncedToPos()).isTrue();
            assertThat(repository.leaseHolder(pack.getId())).isEmpty();

            ArgumentCaptor<PosListingPayload> payload = ArgumentCaptor.forClass(PosListingPayload.class);
            verify(posApiPort).createListing(payload.capture());
            assertThat(payload.getValue().externalId()).isEqualTo(pack.getId().value());
            assertThat(payload.getValue().ticketCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("가격이 없는 유령 팩은 API 를 호출하지 않고 검증 실패로 기록한다")
        void ghostPack_rejected() {
            SeatPack ghost = stored(SeatPack.create(pricedCandidate("A", null, "1", "2"), PackState.CREATE, List.of(), NOW));

            PackSyncOutcome outcome = processor.process(ghost.getId(), OPERATION_ID, performances);

            assertThat(outcome).isEqualTo(PackSyncOutcome.VALIDATION_FAILED);
            verifyNoInteractions(posApiPort);
            SeatPack saved = repository.get(ghost.getId());
            assertThat(saved.getPosStatus()).isEqualTo(PosStatus.FAILED);
            assertThat(saved.getPosSyncAttempts()).isEqualTo(1);
            assertThat(saved.getPosSyncError()).startsWith("Validation failed").contains("price must be positive");
        }

        @Test
        @DisplayName("리스팅 생성이 실패하면 시도 횟수를 올리고 다음 주기에 재시도한다")
        void createFailure_recorded() {
            SeatPack pack = stored(activePack("A", "1", "2"));
            when(posApiPort.createListing(any())).thenReturn(PosCreateResult.failed(500, "Internal Server Error"));

            PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, performances);

            assertThat(outcome).isEqualTo(PackSyncOutcome.FAILED);
            SeatPack saved = repository.get(pack.getId());
            assertThat(saved.getPosSyncAttempts()).isEqualTo(1);
            assertThat(saved.isSyncedToPos()).isFalse();
            assertThat(saved.getPosSyncError()).contains("Internal Server Error");
        }

        @Test
        @DisplayName("POS 연동이 꺼진 공연의 팩은 건너뛴다")
        void posDisabledPerformance_skipped() {
            SeatPack pack = stored(activePack("A", "1", "2"));
            Performance disabled = performance();
            disabled.disablePos();

            PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, Map.of(PERFORMANCE_ID, disabled));

            assertThat(outcome).isEqualTo(PackSyncOutcome.SKIPPED);
            verifyNoInteractions(posApiPort);
            assertThat(repository.get(pack.getId()).isSyncedToPos()).isFalse();
        }
    }

    @Nested
    @DisplayName("리스팅 삭제")
    class Delist {

        @Test
        @DisplayName("POS 가 404 를 주면 이미 삭제된 것으로 보고 실패 횟수를 올리지 않는다")
        void notFound_treatedAsSuccess() {
            SeatPack pack = listedPack("L-1", "A", "1", "2");
            pack.vanish();
            stored(pack);
            when(posApiPort.deleteListing("L-1")).thenReturn(PosDeleteResult.notFound());

            PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, performances);

            assertThat(outcome).isEqualTo(PackSyncOutcome.DELISTED);
            SeatPack saved = repository.get(pack.getId());
            assertThat(saved.getPosStatus()).isEqualTo(PosStatus.INACTIVE);
            assertThat(saved.getPosSyncAttempts()).isZero();
            assertThat(saved.isSyncedToPos()).isTrue();
        }

        @Test
        @DisplayName("POS 에 올라간 적 없는 팩은 API 호출 없이 내림 완료")
        void neverListed_noApiCall() {
            SeatPack pack = activePack("A", "1", "2");
            pack.delist(DelistReason.STRUCTURE_CHANGE);
            stored(pack);

            PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, performances);

            assertThat(outcome).isEqualTo(PackSyncOutcome.DELISTED);
            verifyNoInteractions(posApiPort);
            assertThat(repository.get(pack.getId()).getPosStatus()).isEqualTo(PosStatus.INACTIVE);
        }

        @Test
        @DisplayName("삭제가 계속 실패하면 한도까지 시도 후 실패 상태로 남고 미동기화 유지")
        void repeatedFailure_exhaustsRetries() {
            SeatPack pack = listedPack("L-1", "A", "1", "2");
            pack.vanish();
            stored(pack);
            when(posApiPort.deleteListing("L-1")).thenReturn(PosDeleteResult.failed(503, "unavailable"));

            for (int i = 0; i < 5; i++) {
                assertThat(processor.process(pack.getId(), OPERATION_ID, performances))
                        .isEqualTo(PackSyncOutcome.FAILED);
            }

            SeatPack saved = repository.get(pack.getId());
            assertThat(saved.getPosSyncAttempts()).isEqualTo(5);
            assertThat(saved.getPosStatus()).isEqualTo(PosStatus.FAILED);
            assertThat(saved.isSyncedToPos()).isFalse();
            assertThat(saved.isRetryExhausted(5)).isTrue();
        }
    }

    @Test
    @DisplayName("다른 보유자가 리스를 잡고 있으면 아무것도 하지 않는다")
    void leaseConflict_skipped() {
        SeatPack pack = stored(activePack("A", "1", "2"));
        repository.lockedBy(pack.getId(), "reconcile_other");

        PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, performances);

        assertThat(outcome).isEqualTo(PackSyncOutcome.LEASE_CONFLICT);
        verifyNoInteractions(posApiPort);
        assertThat(repository.leaseHolder(pack.getId())).contains("reconcile_other");
    }

    @Nested
    @DisplayName("보상 작업")
    class Rollback {

        @BeforeEach
        void failWhenMarkingPushed() {
            repository.failSaveWhen(pack -> pack.getPosStatus() == PosStatus.ACTIVE && pack.getPosListingId() != null);
        }

        @Test
        @DisplayName("리스팅 생성 후 로컬 저장이 실패하면 만든 리스팅을 삭제한다")
        void localFailure_deletesCreatedListing() {
            SeatPack pack = stored(activePack("A", "1", "2"));
            when(posApiPort.createListing(any())).thenReturn(PosCreateResult.created("L-100"));
            when(posApiPort.deleteListing("L-100")).thenReturn(PosDeleteResult.deleted());

            PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, performances);

            assertThat(outcome).isEqualTo(PackSyncOutcome.FAILED);
            verify(posApiPort).deleteListing("L-100");
            verifyNoInteractions(failedRollbackRepository);
            SeatPack saved = repository.get(pack.getId());
            assertThat(saved.getPosListingId()).isNull();
            assertThat(saved.getPosStatus()).isEqualTo(PosStatus.FAILED);
        }

        @Test
        @DisplayName("보상 작업도 실패하면 롤백 실패 로그에 남긴다")
        void compensationFailure_logged() {
            SeatPack pack = stored(activePack("A", "1", "2"));
            when(posApiPort.createListing(any())).thenReturn(PosCreateResult.created("L-100"));
            when(posApiPort.deleteListing(anyString())).thenReturn(PosDeleteResult.failed(500, "boom"));

            PackSyncOutcome outcome = processor.process(pack.getId(), OPERATION_ID, performances);

            assertThat(outcome).isEqualTo(PackSyncOutcome.FAILED);
            ArgumentCaptor<FailedRollback> captor = ArgumentCaptor.forClass(FailedRollback.class);
            verify(failedRollbackRepository).append(captor.capture());
            FailedRollback logged = captor.getValue();
            assertThat(logged.getOperationId()).isEqualTo(OPERATION_ID);
            assertThat(logged.getPackId()).isEqualTo(pack.getId().value());
            assertThat(logged.getActionType()).isEqualTo(PackSyncProcessor.DELETE_LISTING_ACTION);
            assertThat(logged.getActionData()).isEqualTo("listingId=L-100");
            assertThat(logged.isResolved()).isFalse();
        }
    }
}
