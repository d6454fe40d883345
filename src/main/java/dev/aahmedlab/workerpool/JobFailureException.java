package dev.aahmedlab.workerpool;

import java.util.concurrent.ExecutionException;

/**
 * Raised by {@link Future#get()} when the job behind the future failed. The cause is the exact
 * {@link Throwable} the job threw.
 *
 * @since 1.0.0
 */
public class JobFailureException extends ExecutionException {
  private static final long serialVersionUID = 1L;

  public JobFailureException(Throwable cause) {
    super("Job failed: " + cause, cause);
  }
}
