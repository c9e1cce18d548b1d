package com.consullo.imaging.history;

import java.util.List;

/**
 * Accumulated geometric state: one rotation and a pair of flip flags, applied rotate-then-flip.
 *
 * @param rotation clockwise rotation, one of 0, 90, 180, 270
 * @param flipHorizontal true to mirror columns after rotating
 * @param flipVertical true to mirror rows after rotating
 * @since 1.0
 */
public record NetTransform(int rotation, boolean flipHorizontal, boolean flipVertical) {

  public static final NetTransform IDENTITY = new NetTransform(0, false, false);

  public NetTransform {
    if (rotation != 0 && rotation != 90 && rotation != 180 && rotation != 270) {
      throw new IllegalArgumentException("rotation must be 0, 90, 180 or 270: " + rotation);
    }
  }

  /**
   * Folds every transform in the list, ignoring adjustment snapshots.
   *
   * @param operations operations in log order
   * @return net transform
   */
  public static NetTransform fold(List<Operation> operations) {
    NetTransform net = IDENTITY;
    for (Operation op : operations) {
      final NetTransform current = net;
      net = op.accept(new OperationVisitor<NetTransform>() {
        @Override
        public NetTransform visitAdjustment(AdjustmentSnapshot snapshot) {
          return current;
        }

        @Override
        public NetTransform visitTransform(TransformOperation transform) {
          return transform.kind().accumulate(current);
        }
      });
    }
    return net;
  }

  public NetTransform rotatedBy(int degrees) {
    return new NetTransform(Math.floorMod(rotation + degrees, 360), flipHorizontal, flipVertical);
  }

  public NetTransform flipped(FlipAxis axis) {
    if (axis == FlipAxis.HORIZONTAL) {
      return new NetTransform(rotation, !flipHorizontal, flipVertical);
    }
    return new NetTransform(rotation, flipHorizontal, !flipVertical);
  }

  public boolean isIdentity() {
    return rotation == 0 && !flipHorizontal && !flipVertical;
  }

  /**
   * True when the rotation is a quarter turn, so width and height trade places.
   *
   * @return whether dimensions swap
   */
  public boolean swapsDimensions() {
    return rotation == 90 || rotation == 270;
  }
}
