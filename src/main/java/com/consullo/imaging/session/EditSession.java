package com.consullo.imaging.session;

import com.consullo.imaging.core.AdjustmentTriple;
import com.consullo.imaging.core.NoImageLoadedException;
import com.consullo.imaging.core.PixelBuffer;
import com.consullo.imaging.core.events.BufferListener;
import com.consullo.imaging.history.AdjustmentSnapshot;
import com.consullo.imaging.history.FlipAxis;
import com.consullo.imaging.history.HistoryEngine;
import com.consullo.imaging.history.HistoryState;
import com.consullo.imaging.history.Operation;
import com.consullo.imaging.history.TransformOperation;
import com.consullo.imaging.settle.AdjustmentSettler;
import com.consullo.imaging.settle.SettlingScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Represents one interactive editing session.
 *
 * <p>
 * Owns:
 * <ul>
 * <li>History engine (operation log + replay)</li>
 * <li>Adjustment settler (debounced slider commits)</li>
 * <li>Settling scheduler (timer source)</li>
 * </ul>
 * </p>
 *
 * <p>
 * Slider input goes through {@link #adjust(AdjustmentTriple)}: the image is
 * previewed immediately and the value is committed once input has been quiet
 * for the settling window. Loading an image or moving through history drops a
 * pending value. Committing a transform first commits a pending value, so the
 * adjustment lands in history before the transform.
 * </p>
 */
public final class EditSession implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(EditSession.class);

  private final Object lock = new Object();

  private final HistoryEngine engine;
  private final SettlingScheduler scheduler;
  private final AdjustmentSettler settler;

  private EditSession(HistoryEngine engine, SettlingScheduler scheduler, EditSessionConfig config) {
    this.engine = engine;
    this.scheduler = scheduler;
    this.settler = new AdjustmentSettler(
            scheduler, config.settlingWindowMillis(), this::commitSettled, lock);
  }

  public static EditSession create(HistoryEngine engine, SettlingScheduler scheduler, EditSessionConfig config) {
    if (engine == null || scheduler == null || config == null) {
      throw new IllegalArgumentException("engine/scheduler/config must not be null.");
    }
    return new EditSession(engine, scheduler, config);
  }

  public void addBufferListener(BufferListener listener) {
    engine.addBufferListener(listener);
  }

  /**
   * Replaces the image and resets history. A pending slider value is dropped.
   *
   * @param image decoded pixels
   */
  public void load(PixelBuffer image) {
    synchronized (lock) {
      settler.cancel();
      engine.load(image);
    }
  }

  /**
   * Previews an in-flight adjustment and (re)starts the settling window.
   *
   * @param inFlight current slider values
   */
  public void adjust(AdjustmentTriple inFlight) {
    synchronized (lock) {
      engine.preview(inFlight);
      settler.arm(inFlight);
    }
  }

  public void adjustBrightness(int brightness) {
    synchronized (lock) {
      adjust(displayedAdjustment().withBrightness(brightness));
    }
  }

  public void adjustContrast(int contrast) {
    synchronized (lock) {
      adjust(displayedAdjustment().withContrast(contrast));
    }
  }

  public void adjustSaturation(int saturation) {
    synchronized (lock) {
      adjust(displayedAdjustment().withSaturation(saturation));
    }
  }

  /**
   * Commits an adjustment immediately, replacing any pending slider value.
   *
   * @param adjustment adjustment to record
   */
  public void commitAdjustment(AdjustmentTriple adjustment) {
    synchronized (lock) {
      settler.cancel();
      engine.commit(new AdjustmentSnapshot(adjustment));
    }
  }

  /**
   * Commits the pending slider value now, if there is one.
   *
   * @return true if something was committed
   */
  public boolean flushPendingAdjustment() {
    synchronized (lock) {
      return settler.flush();
    }
  }

  public void rotateClockwise() {
    commitTransform(TransformOperation.rotateClockwise());
  }

  public void rotateCounterClockwise() {
    commitTransform(TransformOperation.rotateCounterClockwise());
  }

  public void flipHorizontal() {
    commitTransform(TransformOperation.flip(FlipAxis.HORIZONTAL));
  }

  public void flipVertical() {
    commitTransform(TransformOperation.flip(FlipAxis.VERTICAL));
  }

  private void commitTransform(Operation op) {
    synchronized (lock) {
      if (!engine.isLoaded()) {
        throw new NoImageLoadedException("No image loaded.");
      }
      settler.flush();
      engine.commit(op);
    }
  }

  /**
   * Undoes one step. A pending slider value is dropped and the preview cleared.
   *
   * @return true if the cursor moved
   */
  public boolean undo() {
    synchronized (lock) {
      settler.cancel();
      if (engine.undo()) {
        return true;
      }
      engine.discardPreview();
      return false;
    }
  }

  /**
   * Redoes one step. A pending slider value is dropped and the preview cleared.
   *
   * @return true if the cursor moved
   */
  public boolean redo() {
    synchronized (lock) {
      settler.cancel();
      if (engine.redo()) {
        return true;
      }
      engine.discardPreview();
      return false;
    }
  }

  public PixelBuffer currentBuffer() {
    return engine.currentBuffer();
  }

  public HistoryState state() {
    return engine.state();
  }

  /**
   * Returns the adjustment the image currently shows: the pending slider value
   * if there is one, otherwise the committed one.
   *
   * @return displayed adjustment
   */
  public AdjustmentTriple displayedAdjustment() {
    synchronized (lock) {
      AdjustmentTriple pending = settler.pending();
      return pending != null ? pending : engine.state().adjustment();
    }
  }

  public boolean hasPendingAdjustment() {
    return settler.hasPending();
  }

  private void commitSettled(AdjustmentTriple settled) {
    if (!engine.isLoaded()) {
      LOGGER.warn("Settled adjustment {} dropped: no image loaded", settled);
      return;
    }
    engine.commit(new AdjustmentSnapshot(settled));
  }

  @Override
  public void close() {
    synchronized (lock) {
      settler.cancel();
    }
    scheduler.close();
  }
}
