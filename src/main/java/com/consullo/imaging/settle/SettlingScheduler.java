package com.consullo.imaging.settle;

/**
 * Single-shot delayed execution used for the settling window.
 *
 * <p>Implementations decide which thread runs the task. The host can supply one that posts to its own event loop;
 * {@link ScheduledExecutorSettlingScheduler} is the default.
 *
 * @since 1.0
 */
public interface SettlingScheduler extends AutoCloseable {

  /**
   * Runs the task once after the delay unless cancelled first.
   *
   * @param task task to run
   * @param delayMillis delay in milliseconds
   * @return handle that cancels the task
   */
  Cancellable schedule(final Runnable task, final long delayMillis);

  @Override
  void close();

  /**
   * Handle for a scheduled task.
   */
  interface Cancellable {

    /**
     * Prevents the task from running if it has not started yet. Calling this more than once is harmless.
     */
    void cancel();
  }
}
