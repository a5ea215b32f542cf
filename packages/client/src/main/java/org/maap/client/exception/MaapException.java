package org.maap.client.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the client's unchecked exception hierarchy.
 *
 * <p>Every subclass reports a fixed {@link MaapErrorCode} so callers can distinguish a failed
 * remote job from an exhausted poll budget or a transfer that could not be authorized. Optional
 * context entries carry diagnostic values such as job ids or URLs.
 */
public class MaapException extends RuntimeException {
  private final MaapErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public MaapException(MaapErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public MaapException(MaapErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public MaapErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic value and return {@code this} for chaining. */
  public MaapException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
