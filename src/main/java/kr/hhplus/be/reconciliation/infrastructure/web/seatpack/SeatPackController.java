package kr.hhplus.be.reconciliation.infrastructure.web.seatpack;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import kr.hhplus.be.reconciliation.application.port.in.ManualPackUseCase;
import kr.hhplus.be.reconciliation.application.port.in.PackHealthUseCase;
import kr.hhplus.be.reconciliation.application.port.in.SeatPackView;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/seat-packs")
@RequiredArgsConstructor
public class SeatPackController {
    private final ManualPackUseCase manualPackUseCase;
    private final PackHealthUseCase packHealthUseCase;

    @PostMapping("/{packId}/delist")
    public SeatPackView delist(@PathVariable String packId, @Valid @RequestBody DelistRequest req) {
        return manualPackUseCase.manualDelist(new ManualPackUseCase.ManualDelistCommand(packId, req.operator(), req.reason()));
    }

    @PostMapping("/{packId}/reactivate")
    public SeatPackView reactivate(@PathVariable String packId, @Valid @RequestBody OperatorRequest req) {
        return manualPackUseCase.reactivate(new ManualPackUseCase.ReactivateCommand(packId, req.operator()));
    }

    @PostMapping("/{packId}/admin-hold")
    public SeatPackView adminHold(@PathVariable String packId, @Valid @RequestBody AdminHoldRequest req) {
        return manualPackUseCase.adminHold(new ManualPackUseCase.AdminHoldCommand(packId, req.operator(), req.notes()));
    }

    @PostMapping("/{packId}/requeue")
    public SeatPackView requeue(@PathVariable String packId, @Valid @RequestBody OperatorRequest req) {
        return manualPackUseCase.requeue(packId, req.operator());
    }

    @GetMapping("/{packId}/children")
    public List<SeatPackView> children(@PathVariable String packId) {
        return manualPackUseCase.findChildren(packId);
    }

    @GetMapping("/delistable")
    public List<SeatPackView> delistable(@RequestParam String performanceId) {
        return manualPackUseCase.findDelistable(performanceId);
    }

    @GetMapping("/reactivatable")
    public List<SeatPackView> reactivatable(@RequestParam String performanceId) {
        return manualPackUseCase.findReactivatable(performanceId);
    }

    @GetMapping("/manual-delists")
    public List<SeatPackView> recentManualDelists() {
        return manualPackUseCase.findRecentManualDelists();
    }

    @GetMapping("/retry-exhausted")
    public List<SeatPackView> retryExhausted() {
        return manualPackUseCase.findRetryExhausted();
    }

    @GetMapping("/health")
    public PackHealthUseCase.SeatPackHealth health() {
        return packHealthUseCase.checkHealth();
    }

    public record DelistRequest(@NotBlank String operator, @NotBlank String reason) {}
    public record OperatorRequest(@NotBlank String operator) {}
    public record AdminHoldRequest(@NotBlank String operator, String notes) {}
}
