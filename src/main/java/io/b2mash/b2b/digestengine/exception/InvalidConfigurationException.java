package io.b2mash.b2b.digestengine.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Rejects a recurrence spec or rule definition before it is stored. Carries every violation found
 * so a caller can fix them in one round trip.
 */
public class InvalidConfigurationException extends ErrorResponseException {

  private final List<String> violations;

  public InvalidConfigurationException(String title, List<String> violations) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, violations), null);
    this.violations = List.copyOf(violations);
  }

  public InvalidConfigurationException(String title, String violation) {
    this(title, List.of(violation));
  }

  public List<String> getViolations() {
    return violations;
  }

  @Override
  public String getMessage() {
    return getBody().getTitle() + ": " + String.join("; ", violations);
  }

  private static ProblemDetail createProblem(String title, List<String> violations) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(String.join("; ", violations));
    problem.setProperty("violations", List.copyOf(violations));
    return problem;
  }
}
