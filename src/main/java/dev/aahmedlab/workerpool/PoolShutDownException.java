package dev.aahmedlab.workerpool;

import java.util.concurrent.RejectedExecutionException;

/**
 * Thrown when work is submitted to a {@link WorkerPool} that has been shut down.
 *
 * @since 1.0.0
 */
public class PoolShutDownException extends RejectedExecutionException {
  private static final long serialVersionUID = 1L;

  public PoolShutDownException(String poolName) {
    super("Pool '" + poolName + "' has been shut down");
  }
}
