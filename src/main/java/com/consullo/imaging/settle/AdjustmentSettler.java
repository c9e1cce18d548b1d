package com.consullo.imaging.settle;

import com.consullo.imaging.core.AdjustmentTriple;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debounces continuous adjustment input into a single commit.
 *
 * <p>
 * Arm/cancel/fire state machine:
 * <ul>
 * <li>{@link #arm} records the newest in-flight triple, bumps the generation
 * and restarts the settling timer.</li>
 * <li>{@link #cancel} bumps the generation and drops the pending triple.</li>
 * <li>{@link #fire} commits only when its generation is still the latest one
 * and a triple is pending; stale fires are ignored.</li>
 * </ul>
 * </p>
 *
 * <p>
 * All state is guarded by the lock passed in at construction. The owner should
 * hold the same lock while calling in, and the commit action runs under it, so
 * a timer fire cannot interleave with a load or undo.
 * </p>
 */
public final class AdjustmentSettler {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdjustmentSettler.class);

  private final SettlingScheduler scheduler;
  private final long settlingWindowMillis;
  private final Consumer<AdjustmentTriple> commitAction;
  private final Object lock;

  private long generation;
  private AdjustmentTriple pending;
  private SettlingScheduler.Cancellable timer;

  /**
   * Creates a settler.
   *
   * @param scheduler timer source
   * @param settlingWindowMillis quiet period before committing
   * @param commitAction receives the settled triple
   * @param lock lock shared with the owner
   */
  public AdjustmentSettler(
          SettlingScheduler scheduler,
          long settlingWindowMillis,
          Consumer<AdjustmentTriple> commitAction,
          Object lock) {
    if (scheduler == null || commitAction == null || lock == null) {
      throw new IllegalArgumentException("scheduler/commitAction/lock must not be null.");
    }
    if (settlingWindowMillis < 0) {
      throw new IllegalArgumentException("settlingWindowMillis must not be negative.");
    }
    this.scheduler = scheduler;
    this.settlingWindowMillis = settlingWindowMillis;
    this.commitAction = commitAction;
    this.lock = lock;
  }

  /**
   * Records a new in-flight value and restarts the settling window.
   *
   * @param inFlight latest value
   * @return generation of this arm
   */
  public long arm(AdjustmentTriple inFlight) {
    if (inFlight == null) {
      throw new IllegalArgumentException("inFlight must not be null.");
    }
    synchronized (lock) {
      cancelTimer();
      final long armed = ++generation;
      pending = inFlight;
      timer = scheduler.schedule(() -> fire(armed), settlingWindowMillis);
      return armed;
    }
  }

  /**
   * Discards the pending value, if any. A timer that still fires afterwards is
   * ignored.
   */
  public void cancel() {
    synchronized (lock) {
      generation++;
      if (pending != null) {
        LOGGER.debug("cancel: discarding pending {}", pending);
      }
      pending = null;
      cancelTimer();
    }
  }

  /**
   * Commits the pending value for the given generation.
   *
   * @param firedGeneration generation captured when the timer was armed
   * @return true if a commit happened
   */
  public boolean fire(long firedGeneration) {
    synchronized (lock) {
      if (firedGeneration != generation || pending == null) {
        LOGGER.debug("fire: ignoring stale generation {} (latest {})", firedGeneration, generation);
        return false;
      }
      return commitPending();
    }
  }

  /**
   * Commits the pending value now instead of waiting for the window.
   *
   * @return true if a value was pending and got committed
   */
  public boolean flush() {
    synchronized (lock) {
      if (pending == null) {
        return false;
      }
      generation++;
      return commitPending();
    }
  }

  public boolean hasPending() {
    synchronized (lock) {
      return pending != null;
    }
  }

  /**
   * Returns the value waiting to be committed.
   *
   * @return pending triple, or null
   */
  public AdjustmentTriple pending() {
    synchronized (lock) {
      return pending;
    }
  }

  public long generation() {
    synchronized (lock) {
      return generation;
    }
  }

  private boolean commitPending() {
    AdjustmentTriple settled = pending;
    pending = null;
    cancelTimer();
    LOGGER.debug("commit settled adjustment {}", settled);
    commitAction.accept(settled);
    return true;
  }

  private void cancelTimer() {
    if (timer != null) {
      timer.cancel();
      timer = null;
    }
  }
}
