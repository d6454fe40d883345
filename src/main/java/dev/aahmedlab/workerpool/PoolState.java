package dev.aahmedlab.workerpool;

/**
 * Internal state of the worker pool. This enum is package-private and not part of the public API.
 * Use the public boolean methods (isRunning(), isShutdown(), isTerminated()) to check pool state.
 */
enum PoolState {
  RUNNING,
  SHUTDOWN,
  TERMINATED
}
