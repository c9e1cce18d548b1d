package com.consullo.imaging.history;

/**
 * A geometric step: {@link Rotate} or {@link Flip}. No other kinds exist, so
 * every accumulated rotation stays a multiple of 90.
 *
 * @since 1.0
 */
public sealed interface TransformKind permits Rotate, Flip {

  /**
   * Folds this step into an accumulated transform.
   *
   * @param current transform accumulated so far
   * @return transform including this step
   */
  NetTransform accumulate(NetTransform current);
}
