package com.consullo.imaging.history;

import com.consullo.imaging.core.AdjustmentTriple;

/**
 * Committed absolute adjustment state. A later snapshot supersedes every earlier one during replay.
 *
 * @param adjustment the adjustment values
 * @since 1.0
 */
public record AdjustmentSnapshot(AdjustmentTriple adjustment) implements Operation {

  public static final AdjustmentSnapshot IDENTITY = new AdjustmentSnapshot(AdjustmentTriple.IDENTITY);

  public AdjustmentSnapshot {
    if (adjustment == null) {
      throw new IllegalArgumentException("adjustment must not be null.");
    }
  }

  @Override
  public <R> R accept(OperationVisitor<R> visitor) {
    return visitor.visitAdjustment(this);
  }
}
