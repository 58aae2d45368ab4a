package com.peptide_toxicity.exception;

import com.peptide_toxicity.dto.response.GenericResponse;
import com.peptide_toxicity.dto.response.Metadata;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Objects;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // 1. Request body failed bean validation
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<GenericResponse<Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());

        String errorMessage = ex.getBindingResult()
                .getAllErrors()
                .stream()
                .map(DefaultMessageSourceResolvable::getDefaultMessage)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse("Invalid input");

        return ResponseEntity
                .badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(GenericResponse.failure("VALIDATION_ERROR", errorMessage, new Metadata()));
    }

    // 2. Validation failed on query/path parameters
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<GenericResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errorMessage = ex.getConstraintViolations()
                .stream()
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining(", "));

        return new ResponseEntity<>(GenericResponse.failure("CONSTRAINT_VIOLATION", errorMessage, new Metadata()),
                HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<GenericResponse<Object>> handleMethodValidation(HandlerMethodValidationException ex) {
        String errorMessage = ex.getAllValidationResults()
                .stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> result.getMethodParameter().getParameterName() + ": " + error.getDefaultMessage()))
                .collect(Collectors.joining(", "));

        return new ResponseEntity<>(GenericResponse.failure("CONSTRAINT_VIOLATION", errorMessage, new Metadata()),
                HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<GenericResponse<Object>> handleBadParameter(Exception ex) {
        return ResponseEntity.badRequest()
                .body(GenericResponse.failure("BAD_REQUEST", ex.getMessage(), new Metadata()));
    }

    // 3. Invalid/malformed JSON
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<GenericResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        return new ResponseEntity<>(GenericResponse.failure("MALFORMED_JSON", "Request body is invalid or malformed", new Metadata()),
                HttpStatus.BAD_REQUEST);
    }

    // 4. Application specific
    @ExceptionHandler(InvalidSequenceException.class)
    public ResponseEntity<GenericResponse<Object>> handleInvalidSequence(InvalidSequenceException ex) {
        log.warn("Rejected sequences: {}", ex.getInvalidSequences());
        return ResponseEntity.badRequest()
                .body(GenericResponse.failure("INVALID_SEQUENCE", ex.getMessage(), ex.getInvalidSequences(), new Metadata()));
    }

    @ExceptionHandler(BatchNotFoundException.class)
    public ResponseEntity<GenericResponse<Object>> handleBatchNotFound(BatchNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(GenericResponse.failure("NOT_FOUND", ex.getMessage(), new Metadata()));
    }

    @ExceptionHandler(PredictorBusyException.class)
    public ResponseEntity<GenericResponse<Object>> handlePredictorBusy(PredictorBusyException ex) {
        log.warn("Predictor busy: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(GenericResponse.failure("PREDICTOR_BUSY", ex.getMessage(), new Metadata()));
    }

    @ExceptionHandler(PredictorTimeoutException.class)
    public ResponseEntity<GenericResponse<Object>> handlePredictorTimeout(PredictorTimeoutException ex) {
        log.error("Predictor timed out: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(GenericResponse.failure("PREDICTOR_TIMEOUT", ex.getMessage(), new Metadata()));
    }

    @ExceptionHandler(PredictorFailureException.class)
    public ResponseEntity<GenericResponse<Object>> handlePredictorFailure(PredictorFailureException ex) {
        log.error("Predictor failure: {} {}", ex.getMessage(), ex.getDiagnostics(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(GenericResponse.failure("PREDICTOR_FAILURE", ex.getMessage(), new Metadata()));
    }

    @ExceptionHandler(StoreWriteException.class)
    public ResponseEntity<GenericResponse<Object>> handleStoreWrite(StoreWriteException ex) {
        log.error("Store write failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(GenericResponse.failure("STORE_WRITE_ERROR",
                        "Prediction computed but could not be saved: " + ex.getMessage(),
                        ex.getComputedResult(), new Metadata()));
    }

    // 5. Generic fallback
    @ExceptionHandler(Exception.class)
    public ResponseEntity<GenericResponse<Object>> handleGenericException(Exception ex) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return new ResponseEntity<>(GenericResponse.failure(
                "INTERNAL_SERVER_ERROR",
                "Something went wrong. Please try again later.",
                new Metadata()
        ), HttpStatus.INTERNAL_SERVER_ERROR);
    }

}
