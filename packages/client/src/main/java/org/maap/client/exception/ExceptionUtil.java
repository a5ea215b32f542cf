package org.maap.client.exception;

/** Utility helpers for turning exceptions into short diagnostic text. */
public final class ExceptionUtil {
  private static final String API_ERROR = "API error: ";
  private static final String API_ERROR_HTTP = "API error: HTTP ";

  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, top frame first.
   *
   * <p>Example output:
   * {@code org.maap.client.dps.DpsJobClient.refreshMetrics (DpsJobClient.java:42)
   * > org.maap.client.MaapClient.getJob (MaapClient.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /** Convenience overload using a default of 10 frames. */
  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Extract a human-readable message from a throwable chain.
   *
   * <p>When a {@link RemoteCallException} message ({@code "API error: HTTP 400: ..."}) is found
   * anywhere in the chain, the text after the status code is returned. Otherwise the top-level
   * exception is rendered as {@code SimpleClassName: message}.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }

    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && message.contains(API_ERROR)) {
        String apiError = message.substring(message.indexOf(API_ERROR));
        if (apiError.startsWith(API_ERROR_HTTP)) {
          int colon = apiError.indexOf(':', API_ERROR_HTTP.length());
          if (colon > 0 && colon < apiError.length() - 1) {
            return apiError.substring(colon + 1).trim();
          }
        }
        return apiError.substring(API_ERROR.length()).trim();
      }
      current = current.getCause();
    }

    String className = t.getClass().getSimpleName();
    String message = t.getMessage();
    if (message == null || message.isBlank()) {
      return className;
    }
    return className + ": " + message;
  }
}
