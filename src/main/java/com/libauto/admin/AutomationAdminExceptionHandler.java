package com.libauto.admin;

import com.libauto.InvalidScheduleException;
import com.libauto.JobDisabledException;
import com.libauto.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = AutomationAdminController.class)
@ConditionalOnProperty(prefix = "libauto.admin", name = "enabled", havingValue = "true")
public class AutomationAdminExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AutomationAdminExceptionHandler.class);

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "Job not found", e);
    }

    @ExceptionHandler(JobDisabledException.class)
    public ResponseEntity<ErrorResponse> handleDisabled(JobDisabledException e) {
        return respond(HttpStatus.BAD_REQUEST, "Job is disabled", e);
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSchedule(InvalidScheduleException e) {
        return respond(HttpStatus.BAD_REQUEST, "Invalid schedule", e);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, RuntimeException e) {
        log.debug("Admin request rejected with {}: {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(error, e.getMessage()));
    }

    public record ErrorResponse(String error, String message) {
    }
}
