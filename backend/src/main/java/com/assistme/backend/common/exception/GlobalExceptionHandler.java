package com.assistme.backend.common.exception;

import com.assistme.backend.integration.service.IntegrationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry the request later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(IntegrationException.class)
  public ResponseEntity<ProblemDetail> handleIntegrationException(IntegrationException ex) {
    HttpStatus status = ex.code().status();
    if (status.is5xxServerError()) {
      log.warn("Integration request failed: {} {}", ex.code(), ex.getMessage());
    } else {
      log.debug("Integration request rejected: {} {}", ex.code(), ex.getMessage());
    }
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
    problem.setTitle(ex.code().name());
    problem.setProperty("code", ex.code().name());
    return ResponseEntity.status(status).body(problem);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler({ConstraintViolationException.class, HandlerMethodValidationException.class})
  public ResponseEntity<ProblemDetail> handleParameterValidation(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveParameterMessage(ex));
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ProblemDetail> handleMalformedRequest(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Malformed request");
    problem.setDetail(
        ex instanceof MissingServletRequestParameterException missing
            ? missing.getParameterName() + " parameter is required"
            : "Invalid request payload");
    return ResponseEntity.badRequest().body(problem);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ProblemDetail> handleResponseStatusException(ResponseStatusException ex) {
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof BindException bindException) {
      return bindException.getBindingResult().getFieldErrors().stream()
          .findFirst()
          .map(
              error ->
                  error.getDefaultMessage() != null
                      ? error.getField() + ": " + error.getDefaultMessage()
                      : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    return "Invalid request payload";
  }

  private String resolveParameterMessage(Exception ex) {
    if (ex instanceof ConstraintViolationException violations) {
      return violations.getConstraintViolations().stream()
          .map(ConstraintViolation::getMessage)
          .findFirst()
          .orElse("Invalid request parameters");
    }
    if (ex instanceof HandlerMethodValidationException validation) {
      return validation.getAllValidationResults().stream()
          .flatMap(result -> result.getResolvableErrors().stream())
          .map(MessageSourceResolvable::getDefaultMessage)
          .filter(Objects::nonNull)
          .findFirst()
          .orElse("Invalid request parameters");
    }
    return "Invalid request parameters";
  }
}
