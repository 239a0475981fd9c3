package com.specsim.interfaces.api;

import com.specsim.application.sim.exception.DocumentTooLargeException;
import com.specsim.infrastructure.sim.InvalidPipelineInputException;
import com.specsim.infrastructure.sim.PipelineCancelledException;
import com.specsim.infrastructure.sim.serialization.SimSerializationException;
import com.specsim.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidPipelineInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidPipelineInputException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_INPUT", e.getMessage()));
    }

    @ExceptionHandler(SimSerializationException.class)
    public ResponseEntity<ErrorResponse> handleSimParse(SimSerializationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("SIM_PARSE_ERROR", e.getMessage()));
    }

    @ExceptionHandler(DocumentTooLargeException.class)
    public ResponseEntity<ErrorResponse> handleTooLarge(DocumentTooLargeException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ErrorResponse("DOCUMENT_TOO_LARGE", e.getMessage()));
    }

    @ExceptionHandler(PipelineCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(PipelineCancelledException e) {
        log.warn("[GlobalExceptionHandler] Pipeline cancelled: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("PIPELINE_CANCELLED", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ARGUMENT", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Invalid request.");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error. Please try again later."));
    }
}
