package com.consullo.imaging.settle;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SettlingScheduler} backed by a single daemon timer thread.
 */
public final class ScheduledExecutorSettlingScheduler implements SettlingScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledExecutorSettlingScheduler.class);

  private final ScheduledExecutorService executor;

  public ScheduledExecutorSettlingScheduler() {
    this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "SettlingTimer");
      t.setDaemon(true);
      return t;
    });
  }

  @Override
  public Cancellable schedule(Runnable task, long delayMillis) {
    if (task == null) {
      throw new IllegalArgumentException("task must not be null.");
    }
    if (delayMillis < 0) {
      throw new IllegalArgumentException("delayMillis must not be negative.");
    }
    ScheduledFuture<?> future = executor.schedule(() -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        LOGGER.error("Settling task failed", e);
      }
    }, delayMillis, TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
