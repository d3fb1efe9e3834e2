package io.b2mash.b2b.digestengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a digest run would exceed the executions-per-hour or recipients-per-schedule limit.
 * The runner records it as a failed execution; nothing is sent.
 */
public class RateLimitExceededException extends ErrorResponseException {

  public RateLimitExceededException(String detail) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(detail), null);
  }

  @Override
  public String getMessage() {
    return "Rate limit exceeded: " + getBody().getDetail();
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Rate limit exceeded");
    problem.setDetail(detail);
    return problem;
  }
}
