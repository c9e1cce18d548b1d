package com.consullo.imaging.history;

/**
 * Exhaustive dispatch over {@link Operation} variants.
 *
 * @param <R> result type
 * @since 1.0
 */
public interface OperationVisitor<R> {

  R visitAdjustment(AdjustmentSnapshot snapshot);

  R visitTransform(TransformOperation transform);
}
