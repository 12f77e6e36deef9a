/*
 * どこで: Pipeline API
 * 何を: pipeline の例外を HTTP ステータスとエラーボディに変換する
 */
package com.example.pipeline.api;

import com.example.pipeline.orchestrator.EntityNotFoundException;
import com.example.pipeline.queue.JobNotFoundException;
import com.example.pipeline.queue.QueueUnavailableException;
import com.example.pipeline.queue.UnknownQueueException;
import com.example.pipeline.scheduler.DuplicateTaskException;
import com.example.pipeline.scheduler.UnknownTaskException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleJobNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.JOB_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(UnknownQueueException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownQueue(UnknownQueueException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.QUEUE_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(UnknownTaskException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownTask(UnknownTaskException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.TASK_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(EntityNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleEntityNotFound(EntityNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.ENTITY_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(DuplicateTaskException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateTask(DuplicateTaskException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.TASK_ALREADY_REGISTERED, ex.getMessage());
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalState(IllegalStateException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.JOB_STATE_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(QueueUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleQueueUnavailable(QueueUnavailableException ex) {
    logger.warn("admin request rejected because the queue is unavailable: {}", ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.QUEUE_UNAVAILABLE, ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
