package io.b2mash.b2b.digestengine.support;

import java.time.Duration;

/**
 * Failure of an external collaborator (content generator, mail transport) during a run or a
 * dispatch. Always caught by the caller and recorded as data, never propagated to a driver loop.
 */
public class CollaboratorException extends RuntimeException {

  private final boolean timedOut;

  public CollaboratorException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  public static CollaboratorException timeout(String operation, Duration timeout) {
    return new CollaboratorException(operation + " timed out after " + timeout, null, true);
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
