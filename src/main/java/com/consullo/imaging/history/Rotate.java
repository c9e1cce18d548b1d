package com.consullo.imaging.history;

/**
 * Rotation by one quarter turn. Positive angles are clockwise.
 *
 * @param angleDegrees +90 or -90
 * @since 1.0
 */
public record Rotate(int angleDegrees) implements TransformKind {

  public Rotate {
    if (angleDegrees != 90 && angleDegrees != -90) {
      throw new IllegalArgumentException("angleDegrees must be +90 or -90: " + angleDegrees);
    }
  }

  public static Rotate clockwise() {
    return new Rotate(90);
  }

  public static Rotate counterClockwise() {
    return new Rotate(-90);
  }

  @Override
  public NetTransform accumulate(NetTransform current) {
    return current.rotatedBy(angleDegrees);
  }
}
