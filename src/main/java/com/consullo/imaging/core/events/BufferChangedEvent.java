package com.consullo.imaging.core.events;

import java.time.Instant;

/**
 * Published after the working buffer has been fully recomputed, so a display
 * surface can repaint or an export path can pick up the new pixels.
 *
 * @param timestampUtc event timestamp in UTC
 * @param cause what triggered the recompute
 * @param width width of the new working buffer
 * @param height height of the new working buffer
 * @param cursor history cursor after the change
 * @since 1.0
 */
public record BufferChangedEvent(
    Instant timestampUtc,
    Cause cause,
    int width,
    int height,
    int cursor) {

  public enum Cause {
    LOAD,
    COMMIT,
    UNDO,
    REDO,
    PREVIEW,
    PREVIEW_DISCARDED
  }

  /**
   * Creates an event stamped with the current time.
   *
   * @param cause trigger
   * @param width buffer width
   * @param height buffer height
   * @param cursor history cursor
   * @return event
   */
  public static BufferChangedEvent now(Cause cause, int width, int height, int cursor) {
    return new BufferChangedEvent(Instant.now(), cause, width, height, cursor);
  }
}
