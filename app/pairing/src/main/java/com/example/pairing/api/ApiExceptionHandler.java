package com.example.pairing.api;

import com.example.pairing.api.response.FieldViolation;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(RegistrantValidationException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(RegistrantValidationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse("PAIRING_VALIDATION_ERROR", ex.getMessage(), ex.violations()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            new ApiErrorResponse(
                "PAIRING_BAD_REQUEST",
                "request body is missing or malformed",
                invalidFields(ex == null ? null : ex.getCause())));
  }

  @ExceptionHandler(RegistrantNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(RegistrantNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("PAIRING_REGISTRANT_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler({
    StorageUnavailableException.class,
    DataAccessResourceFailureException.class,
    TransientDataAccessException.class
  })
  public ResponseEntity<ApiErrorResponse> handleStorageUnavailable(RuntimeException ex) {
    logger.warn("storage unavailable", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("PAIRING_STORAGE_UNAVAILABLE", "storage is unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled pairing error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("PAIRING_INTERNAL_ERROR", ex.getMessage()));
  }

  private List<FieldViolation> invalidFields(Throwable cause) {
    if (!(cause instanceof MismatchedInputException mismatch) || mismatch.getPath().isEmpty()) {
      return null;
    }
    final String field =
        mismatch.getPath().stream()
            .map(JsonMappingException.Reference::getFieldName)
            .filter(name -> name != null)
            .collect(Collectors.joining("."));
    return field.isEmpty() ? null : List.of(new FieldViolation(field, "has an invalid type"));
  }
}
