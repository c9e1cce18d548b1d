package com.consullo.imaging.core;

import java.util.Arrays;

/**
 * Immutable grid of RGBA8 samples.
 *
 * <p>
 * Samples are stored row-major, four bytes per pixel in R, G, B, A order. A
 * buffer with zero width or height is a valid empty image. Instances are never
 * mutated after construction, so they can be shared freely between the engine
 * and any number of readers.
 * </p>
 *
 * @since 1.0
 */
public final class PixelBuffer {

  /** Samples per pixel. */
  public static final int CHANNELS = 4;

  public static final int RED = 0;
  public static final int GREEN = 1;
  public static final int BLUE = 2;
  public static final int ALPHA = 3;

  private final int width;
  private final int height;
  private final byte[] rgba;

  private PixelBuffer(int width, int height, byte[] rgba) {
    this.width = width;
    this.height = height;
    this.rgba = rgba;
  }

  /**
   * Creates a buffer from a copy of the given samples.
   *
   * @param width width in pixels
   * @param height height in pixels
   * @param rgba row-major RGBA samples, length {@code width * height * 4}
   * @return buffer
   */
  public static PixelBuffer of(int width, int height, byte[] rgba) {
    checkDimensions(width, height);
    if (rgba == null) {
      throw new IllegalArgumentException("rgba must not be null.");
    }
    if (rgba.length != sampleCount(width, height)) {
      throw new IllegalArgumentException(
              "rgba length " + rgba.length + " does not match " + width + "x" + height);
    }
    return new PixelBuffer(width, height, rgba.clone());
  }

  public int getWidth() {
    return width;
  }

  public int getHeight() {
    return height;
  }

  public boolean isEmpty() {
    return width == 0 || height == 0;
  }

  /**
   * Returns one sample as an unsigned value.
   *
   * @param x column
   * @param y row
   * @param channel one of {@link #RED}, {@link #GREEN}, {@link #BLUE}, {@link #ALPHA}
   * @return sample in [0, 255]
   */
  public int getSample(int x, int y, int channel) {
    return rgba[offset(x, y) + channel] & 0xFF;
  }

  /**
   * Returns a pixel packed as non-premultiplied ARGB, the layout used by
   * {@code java.awt.image.BufferedImage#TYPE_INT_ARGB}.
   *
   * @param x column
   * @param y row
   * @return packed pixel
   */
  public int getArgb(int x, int y) {
    int i = offset(x, y);
    return ((rgba[i + ALPHA] & 0xFF) << 24)
            | ((rgba[i + RED] & 0xFF) << 16)
            | ((rgba[i + GREEN] & 0xFF) << 8)
            | (rgba[i + BLUE] & 0xFF);
  }

  /**
   * Returns a copy of all samples.
   *
   * @return row-major RGBA samples
   */
  public byte[] toRgbaBytes() {
    return rgba.clone();
  }

  private int offset(int x, int y) {
    if (x < 0 || x >= width || y < 0 || y >= height) {
      throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
    }
    return (y * width + x) * CHANNELS;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PixelBuffer)) {
      return false;
    }
    PixelBuffer other = (PixelBuffer) o;
    return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(rgba);
  }

  @Override
  public String toString() {
    return "PixelBuffer[" + width + "x" + height + "]";
  }

  public static Builder builder(int width, int height) {
    checkDimensions(width, height);
    return new Builder(width, height, new byte[sampleCount(width, height)]);
  }

  /**
   * Starts a builder pre-filled with the samples of an existing buffer.
   *
   * @param source buffer to copy
   * @return builder
   */
  public static Builder builder(PixelBuffer source) {
    if (source == null) {
      throw new IllegalArgumentException("source must not be null.");
    }
    return new Builder(source.width, source.height, source.rgba.clone());
  }

  private static void checkDimensions(int width, int height) {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("width/height must not be negative.");
    }
  }

  private static int sampleCount(int width, int height) {
    long count = (long) width * height * CHANNELS;
    if (count > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Image too large: " + width + "x" + height);
    }
    return (int) count;
  }

  /**
   * Single-use writer for a new buffer. {@link #build()} hands the samples over
   * without copying, after which the builder can no longer be used.
   */
  public static final class Builder {

    private final int width;
    private final int height;
    private byte[] rgba;

    private Builder(int width, int height, byte[] rgba) {
      this.width = width;
      this.height = height;
      this.rgba = rgba;
    }

    public int getWidth() {
      return width;
    }

    public int getHeight() {
      return height;
    }

    public int getSample(int x, int y, int channel) {
      return samples()[offset(x, y) + channel] & 0xFF;
    }

    public Builder setSample(int x, int y, int channel, int value) {
      samples()[offset(x, y) + channel] = (byte) value;
      return this;
    }

    public Builder setPixel(int x, int y, int r, int g, int b, int a) {
      byte[] s = samples();
      int i = offset(x, y);
      s[i + RED] = (byte) r;
      s[i + GREEN] = (byte) g;
      s[i + BLUE] = (byte) b;
      s[i + ALPHA] = (byte) a;
      return this;
    }

    /**
     * Copies one whole pixel from another buffer.
     *
     * @param x destination column
     * @param y destination row
     * @param source source buffer
     * @param sx source column
     * @param sy source row
     * @return this builder
     */
    public Builder copyPixel(int x, int y, PixelBuffer source, int sx, int sy) {
      System.arraycopy(source.rgba, source.offset(sx, sy), samples(), offset(x, y), CHANNELS);
      return this;
    }

    public PixelBuffer build() {
      PixelBuffer out = new PixelBuffer(width, height, samples());
      rgba = null;
      return out;
    }

    private byte[] samples() {
      if (rgba == null) {
        throw new IllegalStateException("Builder already used.");
      }
      return rgba;
    }

    private int offset(int x, int y) {
      if (x < 0 || x >= width || y < 0 || y >= height) {
        throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
      }
      return (y * width + x) * CHANNELS;
    }
  }
}
