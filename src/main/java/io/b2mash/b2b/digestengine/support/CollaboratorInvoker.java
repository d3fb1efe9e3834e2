package io.b2mash.b2b.digestengine.support;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs blocking collaborator calls on a dedicated pool behind a Resilience4j {@link TimeLimiter}.
 * The running future is cancelled (interrupted) once the timeout elapses so a hung transport never
 * holds a scheduler thread.
 */
@Component
public class CollaboratorInvoker {

  private static final Logger log = LoggerFactory.getLogger(CollaboratorInvoker.class);

  private final AsyncTaskExecutor executor;

  public CollaboratorInvoker(@Qualifier("collaboratorExecutor") AsyncTaskExecutor executor) {
    this.executor = executor;
  }

  /**
   * Invokes {@code call} and waits at most {@code timeout} for it.
   *
   * @throws CollaboratorException on timeout or when the call itself throws
   */
  public <T> T invoke(String operation, Duration timeout, Callable<T> call) {
    var timeLimiter =
        TimeLimiter.of(
            operation,
            TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build());
    try {
      return timeLimiter.executeFutureSupplier(() -> executor.submit(call));
    } catch (TimeoutException e) {
      log.warn("{} timed out after {}", operation, timeout);
      throw CollaboratorException.timeout(operation, timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CollaboratorException(operation + " interrupted", e, false);
    } catch (CollaboratorException e) {
      throw e;
    } catch (ExecutionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      throw new CollaboratorException(operation + " failed: " + describe(cause), cause, false);
    } catch (Exception e) {
      throw new CollaboratorException(operation + " failed: " + describe(e), e, false);
    }
  }

  private static String describe(Throwable t) {
    return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
  }
}
