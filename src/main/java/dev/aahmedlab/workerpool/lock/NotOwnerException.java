package dev.aahmedlab.workerpool.lock;

/**
 * Thrown when a thread releases a {@link VLock} it does not own.
 *
 * @since 1.0.0
 */
public class NotOwnerException extends IllegalMonitorStateException {
  private static final long serialVersionUID = 1L;

  public NotOwnerException(Thread caller, Thread owner) {
    super(
        "Thread "
            + caller.getName()
            + " cannot release a lock "
            + (owner == null ? "that is not held" : "owned by " + owner.getName()));
  }
}
