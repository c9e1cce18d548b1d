package com.consullo.imaging.session;

import com.consullo.imaging.adjust.DefaultColorAdjuster;
import com.consullo.imaging.history.HistoryEngine;
import com.consullo.imaging.settle.ScheduledExecutorSettlingScheduler;
import com.consullo.imaging.settle.SettlingScheduler;

/**
 * Factory for edit sessions with the default adjuster and timer thread.
 */
public final class EditSessionFactory {

  private EditSessionFactory() {
  }

  /**
   * Creates a session with the default 500 ms settling window.
   *
   * @return session
   */
  public static EditSession createDefault() {
    return create(EditSessionConfig.DEFAULT);
  }

  /**
   * Creates a session with the given configuration.
   *
   * @param config session configuration
   * @return session
   */
  public static EditSession create(EditSessionConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("config must not be null.");
    }
    HistoryEngine engine = new HistoryEngine(new DefaultColorAdjuster());
    SettlingScheduler scheduler = new ScheduledExecutorSettlingScheduler();
    return EditSession.create(engine, scheduler, config);
  }
}
