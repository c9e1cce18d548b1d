package com.consullo.imaging.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered operation log with a cursor marking the last applied entry.
 *
 * <p>
 * An empty log has cursor -1. After {@link #reset()} the log holds the identity
 * adjustment snapshot at index 0 and the cursor never drops below 0 again.
 * Entries after the cursor are available for redo; appending while entries are
 * available for redo discards them.
 * </p>
 *
 * <p>Not thread-safe. {@link HistoryEngine} serializes access.
 */
public final class HistoryLog {

  private final List<Operation> operations = new ArrayList<>();
  private int cursor = -1;

  /**
   * Drops everything and starts over from the identity snapshot.
   */
  public void reset() {
    operations.clear();
    operations.add(AdjustmentSnapshot.IDENTITY);
    cursor = 0;
  }

  /**
   * Truncates the log after the cursor, appends the operation and moves the
   * cursor onto it.
   *
   * @param op operation to append
   */
  public void append(Operation op) {
    if (op == null) {
      throw new IllegalArgumentException("op must not be null.");
    }
    if (cursor < 0) {
      throw new IllegalStateException("Log has not been reset.");
    }
    operations.subList(cursor + 1, operations.size()).clear();
    operations.add(op);
    cursor = operations.size() - 1;
  }

  public boolean canUndo() {
    return cursor > 0;
  }

  public boolean canRedo() {
    return cursor >= 0 && cursor < operations.size() - 1;
  }

  public boolean stepBack() {
    if (!canUndo()) {
      return false;
    }
    cursor--;
    return true;
  }

  public boolean stepForward() {
    if (!canRedo()) {
      return false;
    }
    cursor++;
    return true;
  }

  public int cursor() {
    return cursor;
  }

  public int size() {
    return operations.size();
  }

  /**
   * Returns the operations from index 0 through the cursor.
   *
   * @return applied operations (unmodifiable copy)
   */
  public List<Operation> applied() {
    return Collections.unmodifiableList(new ArrayList<>(operations.subList(0, cursor + 1)));
  }

  /**
   * Returns every operation, including the redo tail.
   *
   * @return all operations (unmodifiable copy)
   */
  public List<Operation> all() {
    return Collections.unmodifiableList(new ArrayList<>(operations));
  }
}
