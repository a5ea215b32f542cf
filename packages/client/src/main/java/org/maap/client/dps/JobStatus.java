package org.maap.client.dps;

import java.util.Locale;

/**
 * Lifecycle states reported by the DPS API.
 *
 * <p>State transitions: ACCEPTED → RUNNING → {SUCCEEDED, FAILED}; DISMISSED is reachable from
 * ACCEPTED or RUNNING through cancellation. DEDUPED and OFFLINE are service-defined terminal
 * states that are not errors.
 */
public enum JobStatus {
  /** Queued by the service; the initial state after a successful submission. */
  ACCEPTED("Accepted"),
  /** Executing on a worker. */
  RUNNING("Running"),
  SUCCEEDED("Succeeded"),
  FAILED("Failed"),
  /** Cancelled by request. */
  DISMISSED("Dismissed"),
  /** Identical to an earlier job; the service did not run it again. */
  DEDUPED("Deduped"),
  OFFLINE("Offline"),
  /** Any value the client does not recognize. Treated as terminal, like the service does. */
  UNKNOWN("Unknown");

  private final String wireName;

  JobStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** Case-insensitive lookup; unrecognized or missing values map to {@link #UNKNOWN}. */
  public static JobStatus fromWire(String value) {
    if (value == null) return UNKNOWN;
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (JobStatus s : values()) {
      if (s.wireName.toLowerCase(Locale.ROOT).equals(v)) return s;
    }
    return UNKNOWN;
  }

  /** A job in this state no longer needs polling. */
  public boolean isTerminal() {
    return this != ACCEPTED && this != RUNNING;
  }

  /** Terminal states for which results and metrics are published. */
  public boolean hasOutcome() {
    return this == SUCCEEDED || this == FAILED;
  }
}
