package io.suitegraph;

/** Whether a suite repeats across cycle points or runs each task once. */
public enum CyclingMode {
  /** An initial cycle point is set; every graph line must name its recurrence. */
  CYCLING,
  /** No initial cycle point; graph lines default to the run-once recurrence. */
  NON_CYCLING;

  /**
   * Resolves the mode from a suite's initial cycle point setting.
   *
   * @param initialCyclePoint the configured initial cycle point, may be null
   * @return {@link #CYCLING} if a non-blank initial cycle point is set
   */
  public static CyclingMode fromInitialCyclePoint(String initialCyclePoint) {
    return initialCyclePoint == null || initialCyclePoint.isBlank() ? NON_CYCLING : CYCLING;
  }
}
