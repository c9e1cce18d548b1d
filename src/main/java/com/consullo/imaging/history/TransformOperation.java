package com.consullo.imaging.history;

/**
 * One incremental geometric step.
 *
 * @param kind the rotation or flip
 * @since 1.0
 */
public record TransformOperation(TransformKind kind) implements Operation {

  public TransformOperation {
    if (kind == null) {
      throw new IllegalArgumentException("kind must not be null.");
    }
  }

  public static TransformOperation rotateClockwise() {
    return new TransformOperation(Rotate.clockwise());
  }

  public static TransformOperation rotateCounterClockwise() {
    return new TransformOperation(Rotate.counterClockwise());
  }

  public static TransformOperation flip(FlipAxis axis) {
    return new TransformOperation(new Flip(axis));
  }

  @Override
  public <R> R accept(OperationVisitor<R> visitor) {
    return visitor.visitTransform(this);
  }
}
