package dev.aahmedlab.workerpool;

/**
 * Carries a checked throwable that the pool's {@link FailurePolicy} classified as fatal out of a
 * worker thread. Unchecked throwables are propagated as they are.
 *
 * @since 1.0.0
 */
public class FatalWorkerException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public FatalWorkerException(String workerName, Throwable cause) {
    super("Fatal error in worker " + workerName, cause);
  }
}
