package com.consullo.imaging.session;

/**
 * Edit session configuration values.
 *
 * @param settlingWindowMillis milliseconds slider input must stay unchanged before it is committed to history
 * @since 1.0
 */
public record EditSessionConfig(long settlingWindowMillis) {

  /** Default settling window. */
  public static final long DEFAULT_SETTLING_WINDOW_MILLIS = 500L;

  public static final EditSessionConfig DEFAULT = new EditSessionConfig(DEFAULT_SETTLING_WINDOW_MILLIS);

  public EditSessionConfig {
    if (settlingWindowMillis < 0) {
      throw new IllegalArgumentException("settlingWindowMillis must not be negative.");
    }
  }
}
