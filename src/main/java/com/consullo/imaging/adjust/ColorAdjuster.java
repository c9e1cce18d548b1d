package com.consullo.imaging.adjust;

import com.consullo.imaging.core.AdjustmentTriple;
import com.consullo.imaging.core.PixelBuffer;

/**
 * Maps a pixel buffer and an adjustment triple to a new, adjusted buffer.
 *
 * <p>Implementations must be pure: the input buffer is never modified, and the same inputs always produce the
 * same output bytes. Brightness, contrast and saturation are applied in that fixed order, each stage reading the
 * output of the previous one. Alpha is passed through unchanged.
 *
 * @since 1.0
 */
public interface ColorAdjuster {

  /**
   * Applies the adjustment to every pixel.
   *
   * @param buffer source pixels
   * @param adjustment absolute adjustment to apply
   * @return adjusted pixels, same dimensions as {@code buffer}
   */
  PixelBuffer apply(final PixelBuffer buffer, final AdjustmentTriple adjustment);
}
