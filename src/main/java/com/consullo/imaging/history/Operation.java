package com.consullo.imaging.history;

/**
 * One logged edit action.
 *
 * <p>The set of variants is closed: {@link AdjustmentSnapshot} and {@link TransformOperation}. Code that needs to
 * treat them differently goes through {@link #accept(OperationVisitor)}, so adding a variant breaks every consumer at
 * compile time instead of being silently ignored during replay. Callers cannot add variants of their own.
 *
 * @since 1.0
 */
public sealed interface Operation permits AdjustmentSnapshot, TransformOperation {

  <R> R accept(OperationVisitor<R> visitor);
}
