package io.upreview.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ReviewFlowException.class)
  public ResponseEntity<ProblemDetail> handleReviewFlow(
      ReviewFlowException ex, HttpServletRequest request) {
    if (ex.getRejection() != null) {
      log.warn(
          "Review link rejected: path={}, method={}, reason={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getRejection());
    } else {
      log.info(
          "Review flow refused: path={}, method={}, error={}",
          request.getRequestURI(),
          request.getMethod(),
          ex.getError());
    }
    return ResponseEntity.status(ex.getStatusCode()).body(ex.getBody());
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrity(
      DataIntegrityViolationException ex, HttpServletRequest request) {
    log.warn(
        "Data integrity violation: path={}, method={}, cause={}",
        request.getRequestURI(),
        request.getMethod(),
        ex.getMostSpecificCause().getClass().getSimpleName());
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Conflicting write");
    problem.setDetail("The request conflicts with data that already exists.");
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
