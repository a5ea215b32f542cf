package org.maap.client.auth;

import java.util.Objects;
import okhttp3.Headers;

/**
 * How a download that was refused with HTTP 401 may be retried.
 *
 * <p>Resolved once at client construction by {@link AuthContextResolver} and passed to the
 * retriever; never re-detected per call.
 */
public sealed interface AuthContext {

  /** No escalation is possible; a 401 is final. */
  record Unauthenticated() implements AuthContext {}

  /**
   * Running inside a DPS job: exchange the machine token for short-lived user credentials and
   * retry the origin directly.
   */
  record JobRuntimeToken(String machineToken, String jobId, String tokenEndpoint)
      implements AuthContext {
    public JobRuntimeToken {
      Objects.requireNonNull(machineToken, "machineToken");
      Objects.requireNonNull(jobId, "jobId");
      Objects.requireNonNull(tokenEndpoint, "tokenEndpoint");
    }

    @Override
    public String toString() {
      return "JobRuntimeToken[jobId=" + jobId + ", tokenEndpoint=" + tokenEndpoint + "]";
    }
  }

  /**
   * Interactive session: relay the download through the platform API using the caller's own API
   * headers.
   */
  record ProxyDelegate(Headers apiHeaders, String relayEndpoint, String relaySuffix)
      implements AuthContext {
    public ProxyDelegate {
      Objects.requireNonNull(apiHeaders, "apiHeaders");
      Objects.requireNonNull(relayEndpoint, "relayEndpoint");
      Objects.requireNonNull(relaySuffix, "relaySuffix");
    }

    @Override
    public String toString() {
      return "ProxyDelegate[relayEndpoint=" + relayEndpoint + "]";
    }
  }
}
