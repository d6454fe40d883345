package dev.aahmedlab.workerpool;

/**
 * Lifecycle of a {@link Worker}: it alternates between {@code IDLE} and {@code RUNNING} until it
 * reaches {@code TERMINATED}, after which it is never reused.
 *
 * @since 1.0.0
 */
public enum WorkerState {
  IDLE,
  RUNNING,
  TERMINATED
}
