package com.consullo.imaging.demo;

import com.consullo.imaging.core.AdjustmentTriple;
import com.consullo.imaging.core.PixelBuffer;
import com.consullo.imaging.history.HistoryState;
import com.consullo.imaging.io.PixelBufferImages;
import com.consullo.imaging.session.EditSession;
import com.consullo.imaging.session.EditSessionFactory;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal demo that loads an image, applies a list of editor commands and
 * writes the result as PNG.
 *
 * <p>
 * Usage: {@code ImageEditDemo <input> <output.png> [command...]} where a
 * command is one of {@code cw}, {@code ccw}, {@code flip-h}, {@code flip-v},
 * {@code undo}, {@code redo} or {@code adjust=<brightness>,<contrast>,<saturation>}.
 * </p>
 *
 * @since 1.0
 */
public final class ImageEditDemo {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImageEditDemo.class);

  private ImageEditDemo() {
  }

  /**
   * Demo entry point.
   *
   * @param args args
   * @throws Exception if the demo fails
   */
  public static void main(final String[] args) throws Exception {
    if (args.length < 2) {
      System.err.println("usage: ImageEditDemo <input> <output.png> [cw|ccw|flip-h|flip-v|undo|redo|adjust=b,c,s]...");
      System.exit(2);
      return;
    }

    final Path input = Path.of(args[0]);
    final Path output = Path.of(args[1]);

    try (final EditSession session = EditSessionFactory.createDefault()) {
      session.load(PixelBufferImages.read(input));
      for (int i = 2; i < args.length; i++) {
        apply(session, args[i]);
      }

      final HistoryState state = session.state();
      final PixelBuffer result = session.currentBuffer();
      LOGGER.info("Final state: cursor {}/{} transform={} adjustment={}",
              state.cursor(), state.size() - 1, state.transform(), state.adjustment());

      PixelBufferImages.writePng(result, output);
      LOGGER.info("Wrote {} ({}x{})", output, result.getWidth(), result.getHeight());
    }
  }

  /**
   * Applies one command to the session.
   *
   * @param session session
   * @param command command token
   */
  static void apply(final EditSession session, final String command) {
    switch (command) {
      case "cw":
        session.rotateClockwise();
        break;
      case "ccw":
        session.rotateCounterClockwise();
        break;
      case "flip-h":
        session.flipHorizontal();
        break;
      case "flip-v":
        session.flipVertical();
        break;
      case "undo":
        if (!session.undo()) {
          LOGGER.info("Nothing to undo");
        }
        break;
      case "redo":
        if (!session.redo()) {
          LOGGER.info("Nothing to redo");
        }
        break;
      default:
        if (command.startsWith("adjust=")) {
          session.commitAdjustment(parseAdjustment(command.substring("adjust=".length())));
          break;
        }
        throw new IllegalArgumentException("Unknown command: " + command);
    }
    LOGGER.info("Applied {}", command);
  }

  static AdjustmentTriple parseAdjustment(final String value) {
    final String[] parts = value.split(",");
    if (parts.length != 3) {
      throw new IllegalArgumentException("Expected brightness,contrast,saturation but got: " + value);
    }
    try {
      return new AdjustmentTriple(
              Integer.parseInt(parts[0].trim()),
              Integer.parseInt(parts[1].trim()),
              Integer.parseInt(parts[2].trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid adjustment: " + value, e);
    }
  }
}
