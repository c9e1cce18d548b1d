package com.consullo.imaging.adjust;

import com.consullo.imaging.core.AdjustmentTriple;
import com.consullo.imaging.core.PixelBuffer;

/**
 * Default brightness/contrast/saturation math.
 *
 * <p>
 * Per RGB channel:
 * <ul>
 * <li>Brightness: {@code c + (brightness - 100) * 2.55}.</li>
 * <li>Contrast: {@code factor * (c - 128) + 128} with
 * {@code factor = 259 * (k + 255) / (255 * (259 - k))} and
 * {@code k = contrast - 100}, so 100 maps to a factor of exactly 1.</li>
 * <li>Saturation: {@code gray + (saturation / 100) * (c - gray)} where gray is
 * the luma of the post-contrast pixel.</li>
 * </ul>
 * Every stage clamps to [0, 255] and rounds half away from zero before the next
 * stage reads the value, as if the channel were stored back into a byte.
 * </p>
 */
public final class DefaultColorAdjuster implements ColorAdjuster {

  static final double BRIGHTNESS_STEP = 2.55;

  static final double LUMA_RED = 0.2989;
  static final double LUMA_GREEN = 0.587;
  static final double LUMA_BLUE = 0.114;

  @Override
  public PixelBuffer apply(PixelBuffer buffer, AdjustmentTriple adjustment) {
    if (buffer == null || adjustment == null) {
      throw new IllegalArgumentException("buffer/adjustment must not be null.");
    }

    double shift = brightnessShift(adjustment.brightness());
    double factor = contrastFactor(adjustment.contrast());
    double satFactor = adjustment.saturation() / 100.0;

    PixelBuffer.Builder out = PixelBuffer.builder(buffer);
    int width = buffer.getWidth();
    int height = buffer.getHeight();
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        int r = buffer.getSample(x, y, PixelBuffer.RED);
        int g = buffer.getSample(x, y, PixelBuffer.GREEN);
        int b = buffer.getSample(x, y, PixelBuffer.BLUE);

        r = quantize(r + shift);
        g = quantize(g + shift);
        b = quantize(b + shift);

        r = quantize(factor * (r - 128) + 128);
        g = quantize(factor * (g - 128) + 128);
        b = quantize(factor * (b - 128) + 128);

        double gray = LUMA_RED * r + LUMA_GREEN * g + LUMA_BLUE * b;
        r = quantize(gray + satFactor * (r - gray));
        g = quantize(gray + satFactor * (g - gray));
        b = quantize(gray + satFactor * (b - gray));

        out.setSample(x, y, PixelBuffer.RED, r);
        out.setSample(x, y, PixelBuffer.GREEN, g);
        out.setSample(x, y, PixelBuffer.BLUE, b);
      }
    }
    return out.build();
  }

  static double brightnessShift(int brightness) {
    return (brightness - AdjustmentTriple.NEUTRAL) * BRIGHTNESS_STEP;
  }

  static double contrastFactor(int contrast) {
    // k is in [-100, 100], so the divisor stays in [159, 359].
    int k = contrast - AdjustmentTriple.NEUTRAL;
    return (259.0 * (k + 255)) / (255.0 * (259 - k));
  }

  /**
   * Clamps to [0, 255] and rounds half away from zero.
   *
   * @param value channel value
   * @return byte-range channel value
   */
  static int quantize(double value) {
    if (value <= 0.0) {
      return 0;
    }
    if (value >= 255.0) {
      return 255;
    }
    return (int) Math.floor(value + 0.5);
  }
}
