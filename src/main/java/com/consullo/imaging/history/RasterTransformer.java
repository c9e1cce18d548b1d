package com.consullo.imaging.history;

import com.consullo.imaging.core.PixelBuffer;

/**
 * Applies a {@link NetTransform} to a raster in one pass.
 *
 * <p>
 * Each destination pixel is mapped back to exactly one source pixel: first the
 * flips are undone within the output dimensions, then the rotation. Quarter
 * turns swap width and height; nothing is cropped or padded.
 * </p>
 */
public final class RasterTransformer {

  private RasterTransformer() {
  }

  /**
   * Rotates then flips the source.
   *
   * @param source source raster
   * @param transform net transform
   * @return transformed raster, or {@code source} itself when the transform is the identity
   */
  public static PixelBuffer apply(PixelBuffer source, NetTransform transform) {
    if (source == null || transform == null) {
      throw new IllegalArgumentException("source/transform must not be null.");
    }
    if (transform.isIdentity()) {
      return source;
    }

    int srcWidth = source.getWidth();
    int srcHeight = source.getHeight();
    int outWidth = transform.swapsDimensions() ? srcHeight : srcWidth;
    int outHeight = transform.swapsDimensions() ? srcWidth : srcHeight;

    PixelBuffer.Builder out = PixelBuffer.builder(outWidth, outHeight);
    for (int dy = 0; dy < outHeight; dy++) {
      for (int dx = 0; dx < outWidth; dx++) {
        // Position in the rotated (pre-flip) raster.
        int rx = transform.flipHorizontal() ? outWidth - 1 - dx : dx;
        int ry = transform.flipVertical() ? outHeight - 1 - dy : dy;

        int sx;
        int sy;
        switch (transform.rotation()) {
          case 90:
            sx = ry;
            sy = srcHeight - 1 - rx;
            break;
          case 180:
            sx = srcWidth - 1 - rx;
            sy = srcHeight - 1 - ry;
            break;
          case 270:
            sx = srcWidth - 1 - ry;
            sy = rx;
            break;
          default:
            sx = rx;
            sy = ry;
            break;
        }
        out.copyPixel(dx, dy, source, sx, sy);
      }
    }
    return out.build();
  }
}
