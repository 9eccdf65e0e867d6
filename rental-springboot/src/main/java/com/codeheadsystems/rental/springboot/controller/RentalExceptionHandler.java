package com.codeheadsystems.rental.springboot.controller;

import com.codeheadsystems.rental.model.MessageResponse;
import com.codeheadsystems.rental.server.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates core exceptions into {@code {"message": ...}} responses.
 * <ul>
 *   <li>{@link StoreException}: status from its kind (400, 409 or 500)</li>
 *   <li>{@link IllegalArgumentException} and unreadable bodies: 400</li>
 *   <li>{@link SecurityException}: 401</li>
 * </ul>
 */
@RestControllerAdvice
public class RentalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(RentalExceptionHandler.class);

  @ExceptionHandler(StoreException.class)
  public ResponseEntity<MessageResponse> store(StoreException e) {
    if (e.kind() == StoreException.Kind.TRANSPORT) {
      log.error("Document store failure: {}", e.getMessage(), e);
    }
    return ResponseEntity.status(e.kind().httpStatus()).body(new MessageResponse(e.getMessage()));
  }

  @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class})
  public ResponseEntity<MessageResponse> badRequest(Exception e) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new MessageResponse(e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<MessageResponse> unreadable(HttpMessageNotReadableException e) {
    log.debug("Unreadable request body: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new MessageResponse("Invalid request body"));
  }

  @ExceptionHandler(SecurityException.class)
  public ResponseEntity<MessageResponse> unauthorized(SecurityException e) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new MessageResponse(e.getMessage()));
  }
}
