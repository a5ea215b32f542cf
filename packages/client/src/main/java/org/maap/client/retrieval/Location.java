package org.maap.client.retrieval;

import java.util.Objects;
import java.util.Optional;

/**
 * Where to fetch one data object from and under which file name to store it.
 *
 * <p>When the primary is an S3 object, the fallback (if any) is an HTTPS URL for the same file
 * name. For any other primary the fallback is the primary itself.
 *
 * @param fallback nullable; see {@link #fallbackCandidate()}
 */
public record Location(
    DownloadCandidate primary, DownloadCandidate fallback, String destinationName) {

  public Location {
    Objects.requireNonNull(primary, "primary");
    Objects.requireNonNull(destinationName, "destinationName");
    if (destinationName.isBlank()) {
      throw new IllegalArgumentException("No file name can be derived from " + primary.url());
    }
  }

  /** Location whose fallback is the primary itself. */
  public static Location direct(DownloadCandidate primary, String destinationName) {
    return new Location(primary, primary, destinationName);
  }

  public Optional<DownloadCandidate> fallbackCandidate() {
    return Optional.ofNullable(fallback);
  }

  /** True when there is a fallback that differs from the primary. */
  public boolean hasDistinctFallback() {
    return fallback != null && !fallback.equals(primary);
  }
}
