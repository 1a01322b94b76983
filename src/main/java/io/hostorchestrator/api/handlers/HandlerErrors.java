package io.hostorchestrator.api.handlers;

import io.hostorchestrator.api.models.responses.ErrorResponse;
import io.hostorchestrator.exceptions.OrchestrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps failures of engine calls to error responses shared by all handlers.
 */
@Slf4j
final class HandlerErrors {
    
    private HandlerErrors() {
    }
    
    static ResponseEntity<Object> toResponse(String operation, Exception e) {
        if (e instanceof OrchestrationException) {
            OrchestrationException oe = (OrchestrationException) e;
            if (oe.getErrorCode().getHttpStatus() >= 500) {
                log.error("Error {}: {}", operation, e.getMessage());
            } else {
                log.warn("Rejected {}: {}", operation, e.getMessage());
            }
            return ResponseEntity.status(oe.getErrorCode().getHttpStatus()).body(ErrorResponse.from(oe));
        }
        if (e instanceof IllegalArgumentException) {
            log.warn("Bad request {}: {}", operation, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        }
        log.error("Error {}: {}", operation, e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
    }
}
