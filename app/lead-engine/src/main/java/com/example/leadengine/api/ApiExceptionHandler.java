package com.example.leadengine.api;

import com.example.leadengine.service.InvalidLeadTransitionException;
import com.example.leadengine.service.LeadNotFoundException;
import com.example.leadengine.service.ReplyNotFoundException;
import com.example.leadengine.service.ReplyNotPendingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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

  @ExceptionHandler(LeadNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleLeadNotFound(LeadNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("LEAD_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(ReplyNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleReplyNotFound(ReplyNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("REPLY_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(InvalidLeadTransitionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTransition(
      InvalidLeadTransitionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("LEAD_INVALID_TRANSITION", ex.getMessage()));
  }

  @ExceptionHandler(ReplyNotPendingException.class)
  public ResponseEntity<ApiErrorResponse> handleReplyNotPending(ReplyNotPendingException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("REPLY_NOT_PENDING", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("LEADENGINE_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("LEADENGINE_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("LEADENGINE_INTERNAL_ERROR", ex.getMessage()));
  }
}
