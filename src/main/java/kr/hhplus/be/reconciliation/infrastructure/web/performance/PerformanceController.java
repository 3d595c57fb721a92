package kr.hhplus.be.reconciliation.infrastructure.web.performance;

import kr.hhplus.be.reconciliation.application.port.in.ManualPackUseCase;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/performances")
@RequiredArgsConstructor
public class PerformanceController {
    private final ManualPackUseCase manualPackUseCase;

    @PutMapping("/{performanceId}/pos-sync")
    public ManualPackUseCase.PerformanceToggleResult togglePosSync(@PathVariable String performanceId,
                                                                   @RequestParam boolean enabled,
                                                                   @RequestHeader(value = "X-Operator", defaultValue = "system") String operator) {
        return manualPackUseCase.setPerformancePosEnabled(performanceId, enabled, operator);
    }
}
