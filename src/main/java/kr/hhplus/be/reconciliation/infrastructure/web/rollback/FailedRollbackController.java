package kr.hhplus.be.reconciliation.infrastructure.web.rollback;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import kr.hhplus.be.reconciliation.application.port.in.PackHealthUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/failed-rollbacks")
@RequiredArgsConstructor
public class FailedRollbackController {
    private final PackHealthUseCase packHealthUseCase;

    @GetMapping
    public List<PackHealthUseCase.FailedRollbackView> unresolved() {
        return packHealthUseCase.findUnresolvedRollbacks();
    }

    @PostMapping("/{id}/resolve")
    public PackHealthUseCase.FailedRollbackView resolve(@PathVariable Long id, @Valid @RequestBody ResolveRequest req) {
        return packHealthUseCase.resolveRollback(id, req.operator(), req.notes());
    }

    public record ResolveRequest(@NotBlank String operator, String notes) {}
}
