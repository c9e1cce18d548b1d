package com.consullo.imaging.io;

import com.consullo.imaging.core.PixelBuffer;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts between {@link PixelBuffer} and {@link BufferedImage}, and reads and writes image files through
 * {@link ImageIO}.
 *
 * @since 1.0
 */
public final class PixelBufferImages {

  private static final Logger LOGGER = LoggerFactory.getLogger(PixelBufferImages.class);

  private PixelBufferImages() {
  }

  /**
   * Copies an image into a buffer. Any source type is accepted; samples are taken as non-premultiplied sRGB.
   *
   * @param image source image
   * @return buffer
   */
  public static PixelBuffer fromBufferedImage(final BufferedImage image) {
    Validate.notNull(image, "image must not be null");
    final int width = image.getWidth();
    final int height = image.getHeight();
    final PixelBuffer.Builder out = PixelBuffer.builder(width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        final int argb = image.getRGB(x, y);
        out.setPixel(x, y, (argb >>> 16) & 0xFF, (argb >>> 8) & 0xFF, argb & 0xFF, argb >>> 24);
      }
    }
    return out.build();
  }

  /**
   * Copies a buffer into a new {@link BufferedImage#TYPE_INT_ARGB} image.
   *
   * @param buffer source pixels, must not be empty
   * @return image
   */
  public static BufferedImage toBufferedImage(final PixelBuffer buffer) {
    Validate.notNull(buffer, "buffer must not be null");
    Validate.isTrue(!buffer.isEmpty(), "Cannot create an image from an empty buffer");
    final BufferedImage image = new BufferedImage(buffer.getWidth(), buffer.getHeight(), BufferedImage.TYPE_INT_ARGB);
    for (int y = 0; y < buffer.getHeight(); y++) {
      for (int x = 0; x < buffer.getWidth(); x++) {
        image.setRGB(x, y, buffer.getArgb(x, y));
      }
    }
    return image;
  }

  /**
   * Decodes an image file.
   *
   * @param path file to read
   * @return decoded pixels
   * @throws IOException if the file cannot be read or no decoder understands it
   */
  public static PixelBuffer read(final Path path) throws IOException {
    Validate.notNull(path, "path must not be null");
    final BufferedImage image = ImageIO.read(path.toFile());
    if (image == null) {
      throw new IOException("Unsupported image format: " + path);
    }
    LOGGER.debug("read: {} ({}x{})", path, image.getWidth(), image.getHeight());
    return fromBufferedImage(image);
  }

  /**
   * Encodes a buffer as PNG.
   *
   * @param buffer pixels to write
   * @param path destination file, replaced if it exists
   * @throws IOException if writing fails
   */
  public static void writePng(final PixelBuffer buffer, final Path path) throws IOException {
    Validate.notNull(path, "path must not be null");
    final BufferedImage image = toBufferedImage(buffer);
    final Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    if (!ImageIO.write(image, "png", path.toFile())) {
      throw new IOException("No PNG writer available");
    }
    LOGGER.debug("writePng: {} ({}x{})", path, buffer.getWidth(), buffer.getHeight());
  }
}
