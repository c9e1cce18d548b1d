package com.consullo.imaging.history;

/**
 * Mirror along one axis. Two flips on the same axis cancel out.
 *
 * @param axis mirror axis
 * @since 1.0
 */
public record Flip(FlipAxis axis) implements TransformKind {

  public Flip {
    if (axis == null) {
      throw new IllegalArgumentException("axis must not be null.");
    }
  }

  @Override
  public NetTransform accumulate(NetTransform current) {
    return current.flipped(axis);
  }
}
