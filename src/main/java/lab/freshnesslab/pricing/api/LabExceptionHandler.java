package lab.freshnesslab.pricing.api;

import lab.freshnesslab.pricing.dto.ApiError;
import lab.freshnesslab.pricing.exception.ConnectionExhaustedException;
import lab.freshnesslab.pricing.exception.InvalidRefreshIntervalException;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.exception.PoolUnavailableException;
import lab.freshnesslab.pricing.exception.RefreshFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LabExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LabExceptionHandler.class);

    @ExceptionHandler(InvalidRefreshIntervalException.class)
    public ResponseEntity<ApiError> handleInvalidInterval(InvalidRefreshIntervalException ex) {
        log.warn("Rejected refresh interval requestedSeconds={}", ex.getRequestedSeconds());
        return ResponseEntity.badRequest().body(ApiError.of(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request message={}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of(ex.getMessage()));
    }

    @ExceptionHandler({PoolUnavailableException.class, ConnectionExhaustedException.class})
    public ResponseEntity<ApiError> handleUnavailable(LabBackendException ex) {
        log.warn("Backend unavailable family={} message={}", ex.getFamily(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiError.of(ex.getMessage()));
    }

    @ExceptionHandler(RefreshFailedException.class)
    public ResponseEntity<ApiError> handleRefreshFailed(RefreshFailedException ex) {
        log.error("Refresh failed message={}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of(ex.getMessage()));
    }

    @ExceptionHandler(LabBackendException.class)
    public ResponseEntity<ApiError> handleBackend(LabBackendException ex) {
        log.error("Backend error family={} message={}", ex.getFamily(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiError.of(ex.getMessage()));
    }
}
