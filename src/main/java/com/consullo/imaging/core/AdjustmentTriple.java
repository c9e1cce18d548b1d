package com.consullo.imaging.core;

import org.apache.commons.lang3.Validate;

/**
 * Absolute color adjustment state. Each field is a percentage in [0, 200] where
 * 100 leaves the image unchanged.
 *
 * @param brightness brightness percentage
 * @param contrast contrast percentage
 * @param saturation saturation percentage
 * @since 1.0
 */
public record AdjustmentTriple(int brightness, int contrast, int saturation) {

  public static final int MIN = 0;
  public static final int MAX = 200;
  public static final int NEUTRAL = 100;

  /** The no-change triple {100, 100, 100}. */
  public static final AdjustmentTriple IDENTITY = new AdjustmentTriple(NEUTRAL, NEUTRAL, NEUTRAL);

  public AdjustmentTriple {
    Validate.inclusiveBetween(MIN, MAX, brightness, "brightness must be in [0, 200]");
    Validate.inclusiveBetween(MIN, MAX, contrast, "contrast must be in [0, 200]");
    Validate.inclusiveBetween(MIN, MAX, saturation, "saturation must be in [0, 200]");
  }

  public boolean isIdentity() {
    return brightness == NEUTRAL && contrast == NEUTRAL && saturation == NEUTRAL;
  }

  public AdjustmentTriple withBrightness(int value) {
    return new AdjustmentTriple(value, contrast, saturation);
  }

  public AdjustmentTriple withContrast(int value) {
    return new AdjustmentTriple(brightness, value, saturation);
  }

  public AdjustmentTriple withSaturation(int value) {
    return new AdjustmentTriple(brightness, contrast, value);
  }
}
