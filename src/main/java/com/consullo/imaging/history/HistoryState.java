package com.consullo.imaging.history;

import com.consullo.imaging.core.AdjustmentTriple;

/**
 * Immutable view of the state derived from the history log, for binding
 * toolbar buttons and slider positions.
 *
 * @param cursor index of the last applied operation
 * @param size number of operations in the log
 * @param transform net transform up to the cursor
 * @param adjustment effective adjustment up to the cursor
 * @since 1.0
 */
public record HistoryState(
    int cursor,
    int size,
    NetTransform transform,
    AdjustmentTriple adjustment) {

  public boolean canUndo() {
    return cursor > 0;
  }

  public boolean canRedo() {
    return cursor < size - 1;
  }
}
