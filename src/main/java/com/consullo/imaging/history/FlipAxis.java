package com.consullo.imaging.history;

/**
 * Mirror axis. {@link #HORIZONTAL} reverses columns, {@link #VERTICAL} reverses rows.
 *
 * @since 1.0
 */
public enum FlipAxis {
  HORIZONTAL,
  VERTICAL
}
