package io.b2mash.b2b.digestengine.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps failures that are not already {@link org.springframework.web.ErrorResponseException}s.
 * Domain exceptions in this package carry their own ProblemDetail and are rendered by the base
 * class.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {
    log.warn(
        "Rejected request: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }

  @ExceptionHandler(InvalidConfigurationException.class)
  public ResponseEntity<ProblemDetail> handleInvalidConfiguration(
      InvalidConfigurationException ex, HttpServletRequest request) {
    log.warn(
        "Invalid configuration: path={}, violations={}",
        request.getRequestURI(),
        ex.getViolations());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.getBody());
  }
}
