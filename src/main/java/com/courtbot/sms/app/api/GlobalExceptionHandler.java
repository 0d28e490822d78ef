package com.courtbot.sms.app.api;

import com.courtbot.sms.app.exception.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

/** Maps request and infrastructure failures to plain-text responses. */
@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    ConstraintViolationException.class,
    HandlerMethodValidationException.class,
    HttpMediaTypeNotSupportedException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<String> handleBadRequest(Exception ex, HttpServletRequest request) {
    log.warn(
        "HTTP_ERROR path={} method={} errorType={} errorMessage={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getClass().getSimpleName(),
        ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.TEXT_PLAIN)
        .body("Bad request");
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<String> handleStoreUnavailable(
      StoreUnavailableException ex, HttpServletRequest request) {
    log.error(
        "HTTP_ERROR path={} method={} errorType={} errorMessage={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getClass().getSimpleName(),
        ex.getMessage(),
        ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .contentType(MediaType.TEXT_PLAIN)
        .body("Sorry, service temporarily unavailable");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<String> handleUnexpected(Exception ex, HttpServletRequest request) {
    log.error(
        "HTTP_ERROR path={} method={} errorType={} errorMessage={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getClass().getSimpleName(),
        ex.getMessage(),
        ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.TEXT_PLAIN)
        .body("Sorry, internal server error");
  }
}
