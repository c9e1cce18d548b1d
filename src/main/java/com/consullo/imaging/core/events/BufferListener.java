package com.consullo.imaging.core.events;

import com.consullo.imaging.core.PixelBuffer;

/**
 * Listener interface for working-buffer changes.
 *
 * @since 1.0
 */
public interface BufferListener {

  /**
   * Called after the working buffer has been replaced.
   *
   * @param buffer the new working buffer
   * @param event event describing the change
   */
  void onBufferChanged(PixelBuffer buffer, BufferChangedEvent event);
}
