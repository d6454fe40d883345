package dev.aahmedlab.workerpool;

/**
 * Decides which throwables raised by a job are captured into its future and which are fatal to the
 * worker that ran it.
 *
 * @since 1.0.0
 */
public enum FailurePolicy {
  /**
   * Captures every {@link Exception}. Any other throwable terminates the worker and leaves the
   * job's future unresolved, so callers blocked in an untimed {@code get()} wait forever.
   *
   * @since 1.0.0
   */
  CAPTURE_EXCEPTIONS,

  /**
   * Captures every {@link Exception}. Any other throwable is stored in the job's future before it
   * terminates the worker.
   *
   * @since 1.0.0
   */
  RESOLVE_AND_TERMINATE,

  /**
   * Captures every throwable; workers never die from a job.
   *
   * @since 1.0.0
   */
  CAPTURE_ALL;

  boolean isCapturable(Throwable t) {
    return this == CAPTURE_ALL || t instanceof Exception;
  }

  boolean resolvesFatal() {
    return this == RESOLVE_AND_TERMINATE;
  }
}
