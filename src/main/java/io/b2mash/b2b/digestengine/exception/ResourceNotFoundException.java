package io.b2mash.b2b.digestengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Raised when an operation references a schedule, group, rule or template id that is unknown. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final Object resourceId;

  public ResourceNotFoundException(String resourceType, Object resourceId) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, resourceId), null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getResourceId() {
    return resourceId;
  }

  @Override
  public String getMessage() {
    return resourceType + " " + resourceId + " not found";
  }

  private static ProblemDetail createProblem(String resourceType, Object resourceId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail("No " + resourceType.toLowerCase() + " found with id " + resourceId);
    return problem;
  }
}
