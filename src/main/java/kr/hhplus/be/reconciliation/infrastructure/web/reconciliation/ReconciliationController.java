package kr.hhplus.be.reconciliation.infrastructure.web.reconciliation;

import jakarta.validation.Valid;
import kr.hhplus.be.reconciliation.application.port.in.PosSyncUseCase;
import kr.hhplus.be.reconciliation.application.port.in.ReconciliationUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ReconciliationController {
    private final ReconciliationUseCase reconciliationUseCase;
    private final PosSyncUseCase posSyncUseCase;

    @PostMapping("/reconciliations")
    public ReconciliationUseCase.WorkflowResult reconcile(@Valid @RequestBody ReconcileRequest request) {
        return reconciliationUseCase.reconcile(request.toCommand());
    }

    @PostMapping("/pos-sync")
    public PosSyncUseCase.PosSyncResult syncNow(@RequestParam(required = false) String performanceId) {
        return posSyncUseCase.syncPendingPacks(performanceId);
    }
}
