package kr.hhplus.be.reconciliation.infrastructure.web.common;

import kr.hhplus.be.reconciliation.domain.performance.PerformanceNotFoundException;
import kr.hhplus.be.reconciliation.domain.rollback.FailedRollbackNotFoundException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.InvalidPackTransitionException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.PackLeaseConflictException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.PackValidationException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.PackVersionConflictException;
import kr.hhplus.be.reconciliation.domain.seatpack.exception.SeatPackNotFoundException;
import kr.hhplus.be.reconciliation.infrastructure.redis.lock.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    record ErrorResponse(String code, String message) {}

    @ExceptionHandler({SeatPackNotFoundException.class, PerformanceNotFoundException.class, FailedRollbackNotFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    ErrorResponse handleNotFound(RuntimeException e) { return new ErrorResponse("NOT_FOUND", e.getMessage()); }

    @ExceptionHandler({InvalidPackTransitionException.class, IllegalStateException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    ErrorResponse handleInvalidTransition(RuntimeException e) { return new ErrorResponse("INVALID_PACK_STATE", e.getMessage()); }

    @ExceptionHandler({PackLeaseConflictException.class, PackVersionConflictException.class, LockAcquisitionException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    ErrorResponse handleConcurrency(RuntimeException e) {
        log.warn("[API] 동시 작업 충돌: {}", e.getMessage());
        return new ErrorResponse("CONCURRENT_MODIFICATION", e.getMessage());
    }

    @ExceptionHandler(PackValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleValidation(PackValidationException e) { return new ErrorResponse("PACK_VALIDATION_FAILED", e.getMessage()); }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleInvalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .findFirst()
                .orElse("잘못된 요청입니다");
        return new ErrorResponse("INVALID_REQUEST", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalArgument(IllegalArgumentException e) { return new ErrorResponse("INVALID_REQUEST", e.getMessage()); }
}
