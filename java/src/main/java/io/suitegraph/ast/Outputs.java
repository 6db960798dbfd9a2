package io.suitegraph.ast;

import java.util.Map;

/** Task output labels and their short forms. */
public final class Outputs {
  /** Output implied by a bare task name on the left of a trigger. */
  public static final String SUCCEEDED = "succeeded";

  /** Output of a failed task. */
  public static final String FAILED = "failed";

  /** Pseudo-output meaning succeeded or failed. */
  public static final String FINISHED = "finished";

  private static final Map<String, String> ALIASES =
      Map.ofEntries(
          Map.entry("succeed", SUCCEEDED),
          Map.entry("succeeded", SUCCEEDED),
          Map.entry("fail", FAILED),
          Map.entry("failed", FAILED),
          Map.entry("start", "started"),
          Map.entry("started", "started"),
          Map.entry("submit", "submitted"),
          Map.entry("submitted", "submitted"),
          Map.entry("submit-fail", "submit-failed"),
          Map.entry("submit-failed", "submit-failed"),
          Map.entry("expire", "expired"),
          Map.entry("expired", "expired"),
          Map.entry("finish", FINISHED),
          Map.entry("finished", FINISHED));

  private Outputs() {}

  /**
   * Normalises an output label written after a colon.
   *
   * <p>Short forms of the standard outputs map to their past-tense names; any other label is a
   * custom output and is returned unchanged.
   *
   * @param label the label as written
   * @return the normalised label
   */
  public static String normalize(String label) {
    return ALIASES.getOrDefault(label, label);
  }
}
