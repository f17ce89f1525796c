package dev.brainlift.config;

import dev.brainlift.session.SessionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Invalid jobs, requirements and categories surface as {@link IllegalArgumentException} (400).
 * Unknown or evicted sessions surface as {@link SessionNotFoundException} (404).
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(SessionNotFoundException.class)
  ProblemDetail handleSessionNotFound(SessionNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
    problem.setProperty("sessionId", ex.sessionId());
    return problem;
  }
}
