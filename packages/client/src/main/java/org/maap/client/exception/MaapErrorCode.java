package org.maap.client.exception;

/** Stable error categories reported by {@link MaapException}. */
public enum MaapErrorCode {
  /** The remote job reached the {@code Failed} state. */
  JOB_FAILED,
  /** Polling exhausted its time budget before the job reached a terminal state. */
  POLL_TIMEOUT,
  /** Polling was stopped through a cancellation signal. */
  POLL_CANCELLED,
  /** A download could not be completed. */
  TRANSFER_FAILED,
  /** A download was rejected and no authentication escalation succeeded. */
  TRANSFER_UNAUTHORIZED,
  /** A status, result, metrics or acknowledgment document could not be decoded. */
  DOCUMENT_PARSE_ERROR,
  /** The DPS API answered with a non-success HTTP status. */
  REMOTE_CALL_FAILED,
  /** Network level failure while talking to a remote endpoint. */
  TRANSPORT_ERROR,
  /** Missing or invalid client configuration. */
  CONFIGURATION_ERROR,
  UNKNOWN
}
