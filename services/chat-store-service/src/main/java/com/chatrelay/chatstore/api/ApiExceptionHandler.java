package com.chatrelay.chatstore.api;

import com.chatrelay.chatstore.remote.RemoteApiException;
import com.chatrelay.chatstore.remote.RemoteTransportException;
import com.chatrelay.chatstore.store.ChatStoreException;
import com.chatrelay.chatstore.store.MediaInfoUnavailableException;
import com.chatrelay.chatstore.store.UnsupportedStoreOperationException;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of("VALIDATION_ERROR", "Invalid request"));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    log.debug("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of("VALIDATION_ERROR", "Malformed request body"));
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
    return ResponseEntity.badRequest()
        .body(ErrorResponse.of("BAD_REQUEST", "Invalid value for parameter '" + e.getName() + "'"));
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ErrorResponse> handleMissingParameter(
      MissingServletRequestParameterException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of("BAD_REQUEST", e.getMessage()));
  }

  @ExceptionHandler(UnsupportedStoreOperationException.class)
  public ResponseEntity<ErrorResponse> handleUnsupported(UnsupportedStoreOperationException e) {
    return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED)
        .body(ErrorResponse.of("UNSUPPORTED_BY_BACKEND", e.getMessage()));
  }

  @ExceptionHandler(MediaInfoUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleMediaUnavailable(MediaInfoUnavailableException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(ErrorResponse.of("MEDIA_INFO_UNAVAILABLE", e.getMessage()));
  }

  @ExceptionHandler(RemoteTransportException.class)
  public ResponseEntity<ErrorResponse> handleTransport(RemoteTransportException e) {
    log.error("Remote store unreachable", e);
    return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
        .body(ErrorResponse.of("STORE_UNREACHABLE", e.getMessage()));
  }

  @ExceptionHandler(RemoteApiException.class)
  public ResponseEntity<ErrorResponse> handleRemoteApi(RemoteApiException e) {
    log.error(
        "Remote store rejected request: status={} body={}",
        e.getStatusCode(),
        e.getResponseBody());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ErrorResponse.of("STORE_ERROR", e.getMessage()));
  }

  @ExceptionHandler(ChatStoreException.class)
  public ResponseEntity<ErrorResponse> handleStore(ChatStoreException e) {
    log.error("Chat store error", e);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ErrorResponse.of("STORE_ERROR", e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handle500(Exception e) {
    log.error("Unhandled exception", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("INTERNAL_ERROR", "Unexpected error"));
  }

  public record ErrorResponse(String code, String message, Instant timestamp) {
    public static ErrorResponse of(String code, String message) {
      return new ErrorResponse(code, message, Instant.now());
    }
  }
}
