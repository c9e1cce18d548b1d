package com.consullo.imaging.core;

/**
 * Thrown when an edit or read is attempted before any image has been loaded.
 *
 * <p>This is distinct from a loaded image that happens to be empty (0x0).
 *
 * @since 1.0
 */
public class NoImageLoadedException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public NoImageLoadedException(String message) {
    super(message);
  }
}
