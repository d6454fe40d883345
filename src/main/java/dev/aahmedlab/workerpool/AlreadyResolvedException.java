package dev.aahmedlab.workerpool;

/**
 * Thrown when a {@link ReturnValue} that already holds an outcome is resolved again.
 *
 * @since 1.0.0
 */
public class AlreadyResolvedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public AlreadyResolvedException() {
    super("Future is already resolved");
  }
}
