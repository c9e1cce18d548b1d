package com.consullo.imaging.history;

import com.consullo.imaging.adjust.ColorAdjuster;
import com.consullo.imaging.core.AdjustmentTriple;
import com.consullo.imaging.core.NoImageLoadedException;
import com.consullo.imaging.core.PixelBuffer;
import com.consullo.imaging.core.events.BufferChangedEvent;
import com.consullo.imaging.core.events.BufferListener;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the base image and the operation log, and produces the working buffer by
 * replaying the log.
 *
 * <p>
 * Replay, run in full on every change:
 * <ol>
 * <li>Start from the base buffer.</li>
 * <li>Fold every transform up to the cursor into one {@link NetTransform}.</li>
 * <li>Apply it in a single pass, rotate then flip.</li>
 * <li>Apply the last adjustment snapshot up to the cursor (or the preview
 * triple while previewing) through the {@link ColorAdjuster}.</li>
 * </ol>
 * </p>
 *
 * <p>
 * Mutators serialize on an internal lock. The working buffer is published
 * through a volatile reference only once it is complete, so
 * {@link #currentBuffer()} never blocks and never sees a partial result.
 * Listeners are notified outside the lock.
 * </p>
 */
public final class HistoryEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(HistoryEngine.class);

  private final Object lock = new Object();

  private final ColorAdjuster adjuster;
  private final HistoryLog log = new HistoryLog();
  private final List<BufferListener> listeners = new ArrayList<>();

  private PixelBuffer base;
  private AdjustmentTriple preview;
  private volatile PixelBuffer working;

  public HistoryEngine(ColorAdjuster adjuster) {
    if (adjuster == null) {
      throw new IllegalArgumentException("adjuster must not be null.");
    }
    this.adjuster = adjuster;
  }

  /**
   * Starts a new edit session on the given image. Any previous history,
   * including an in-flight preview, is discarded.
   *
   * @param image decoded image pixels
   */
  public void load(PixelBuffer image) {
    if (image == null) {
      throw new IllegalArgumentException("image must not be null.");
    }
    PixelBuffer out;
    BufferChangedEvent ev;
    synchronized (lock) {
      base = image;
      preview = null;
      log.reset();
      out = recompute();
      ev = BufferChangedEvent.now(BufferChangedEvent.Cause.LOAD, out.getWidth(), out.getHeight(), log.cursor());
    }
    LOGGER.info("load: {}x{} image, history reset", image.getWidth(), image.getHeight());
    fireBufferChanged(out, ev);
  }

  /**
   * Appends an operation after the cursor, discarding any redo tail.
   *
   * <p>The new working buffer is computed before the log is touched. If replay
   * fails, the exception propagates and the log, cursor, preview and working
   * buffer are left exactly as they were.
   *
   * @param op operation to record
   */
  public void commit(Operation op) {
    if (op == null) {
      throw new IllegalArgumentException("op must not be null.");
    }
    PixelBuffer out;
    BufferChangedEvent ev;
    synchronized (lock) {
      requireLoaded();
      List<Operation> next = new ArrayList<>(log.applied());
      next.add(op);
      out = replay(next, null);

      int discarded = log.size() - 1 - log.cursor();
      log.append(op);
      preview = null;
      working = out;
      ev = BufferChangedEvent.now(BufferChangedEvent.Cause.COMMIT, out.getWidth(), out.getHeight(), log.cursor());
      LOGGER.debug("commit: {} at {} (discarded {} redo entries)", op, log.cursor(), discarded);
    }
    fireBufferChanged(out, ev);
  }

  /**
   * Steps the cursor back one operation.
   *
   * @return true if the cursor moved, false if already at the first entry or
   *         no image has been loaded yet
   */
  public boolean undo() {
    return step(false);
  }

  /**
   * Steps the cursor forward one operation.
   *
   * @return true if the cursor moved, false if already at the last entry or
   *         no image has been loaded yet
   */
  public boolean redo() {
    return step(true);
  }

  private boolean step(boolean forward) {
    PixelBuffer out;
    BufferChangedEvent ev;
    synchronized (lock) {
      boolean moved = base != null && (forward ? log.stepForward() : log.stepBack());
      if (!moved) {
        return false;
      }
      preview = null;
      out = recompute();
      ev = BufferChangedEvent.now(
              forward ? BufferChangedEvent.Cause.REDO : BufferChangedEvent.Cause.UNDO,
              out.getWidth(), out.getHeight(), log.cursor());
    }
    fireBufferChanged(out, ev);
    return true;
  }

  /**
   * Recomputes the working buffer with an uncommitted adjustment in place of the
   * last committed snapshot. The log is not modified.
   *
   * @param inFlight adjustment currently being dragged
   */
  public void preview(AdjustmentTriple inFlight) {
    if (inFlight == null) {
      throw new IllegalArgumentException("inFlight must not be null.");
    }
    PixelBuffer out;
    BufferChangedEvent ev;
    synchronized (lock) {
      requireLoaded();
      preview = inFlight;
      out = recompute();
      ev = BufferChangedEvent.now(BufferChangedEvent.Cause.PREVIEW, out.getWidth(), out.getHeight(), log.cursor());
    }
    fireBufferChanged(out, ev);
  }

  /**
   * Drops the preview adjustment and shows the committed state again.
   */
  public void discardPreview() {
    PixelBuffer out;
    BufferChangedEvent ev;
    synchronized (lock) {
      if (base == null || preview == null) {
        return;
      }
      preview = null;
      out = recompute();
      ev = BufferChangedEvent.now(
              BufferChangedEvent.Cause.PREVIEW_DISCARDED, out.getWidth(), out.getHeight(), log.cursor());
    }
    fireBufferChanged(out, ev);
  }

  /**
   * Returns the working buffer.
   *
   * @return the fully replayed image
   * @throws NoImageLoadedException if {@link #load(PixelBuffer)} has not been called
   */
  public PixelBuffer currentBuffer() {
    PixelBuffer current = working;
    if (current == null) {
      throw new NoImageLoadedException("No image loaded.");
    }
    return current;
  }

  public boolean isLoaded() {
    return working != null;
  }

  public boolean isPreviewing() {
    synchronized (lock) {
      return preview != null;
    }
  }

  /**
   * Derives the committed state up to the cursor. A live preview is not
   * reflected here.
   *
   * @return history state
   */
  public HistoryState state() {
    synchronized (lock) {
      requireLoaded();
      List<Operation> applied = log.applied();
      return new HistoryState(log.cursor(), log.size(), NetTransform.fold(applied), latestAdjustment(applied));
    }
  }

  /**
   * Returns the whole log, including operations available for redo.
   *
   * @return operations in log order
   */
  public List<Operation> operations() {
    synchronized (lock) {
      return log.all();
    }
  }

  public void addBufferListener(BufferListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("listener must not be null.");
    }
    synchronized (lock) {
      listeners.add(listener);
    }
  }

  public void removeBufferListener(BufferListener listener) {
    synchronized (lock) {
      listeners.remove(listener);
    }
  }

  /**
   * Finds the adjustment that wins during replay: the last snapshot in the list,
   * or the identity if there is none.
   *
   * @param operations operations in log order
   * @return effective adjustment
   */
  static AdjustmentTriple latestAdjustment(List<Operation> operations) {
    AdjustmentTriple latest = AdjustmentTriple.IDENTITY;
    for (Operation op : operations) {
      AdjustmentTriple found = op.accept(new OperationVisitor<AdjustmentTriple>() {
        @Override
        public AdjustmentTriple visitAdjustment(AdjustmentSnapshot snapshot) {
          return snapshot.adjustment();
        }

        @Override
        public AdjustmentTriple visitTransform(TransformOperation transform) {
          return null;
        }
      });
      if (found != null) {
        latest = found;
      }
    }
    return latest;
  }

  private PixelBuffer recompute() {
    PixelBuffer out = replay(log.applied(), preview);
    working = out;
    return out;
  }

  private PixelBuffer replay(List<Operation> applied, AdjustmentTriple inFlight) {
    NetTransform net = NetTransform.fold(applied);
    AdjustmentTriple adjustment = inFlight != null ? inFlight : latestAdjustment(applied);

    PixelBuffer transformed = RasterTransformer.apply(base, net);
    PixelBuffer out = adjuster.apply(transformed, adjustment);
    if (out == null) {
      throw new IllegalStateException("Color adjuster returned null.");
    }

    LOGGER.debug("replay: ops={} transform={} adjustment={}{} -> {}x{}",
            applied.size(), net, adjustment, inFlight != null ? " (preview)" : "",
            out.getWidth(), out.getHeight());
    return out;
  }

  private void requireLoaded() {
    if (base == null) {
      throw new NoImageLoadedException("No image loaded.");
    }
  }

  private void fireBufferChanged(PixelBuffer buffer, BufferChangedEvent ev) {
    List<BufferListener> copy;
    synchronized (lock) {
      copy = new ArrayList<>(listeners);
    }
    for (BufferListener l : copy) {
      try {
        l.onBufferChanged(buffer, ev);
      } catch (RuntimeException e) {
        LOGGER.warn("Buffer listener failed on {} event", ev.cause(), e);
      }
    }
  }
}
