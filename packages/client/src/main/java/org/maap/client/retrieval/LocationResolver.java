package org.maap.client.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Picks the download location of a data object from the candidate URLs listed in its metadata.
 *
 * <ol>
 *   <li>The primary is the first {@code s3://} candidate, else the first candidate listed.
 *   <li>For an S3 primary, the fallback is the first other {@code https://} candidate with the same
 *       basename, so a checksum sidecar such as {@code file.h5.sha256} is never chosen. Otherwise
 *       the fallback is the primary.
 *   <li>The destination name is the primary's basename with any {@code /} removed.
 * </ol>
 *
 * <p>Candidates whose path ends in {@code /} (no basename) are ignored.
 */
public class LocationResolver {
  private static final Logger log = LoggingService.getLogger(LocationResolver.class);

  /** Resolve from plain URLs in listing order. Empty when no usable URL is listed. */
  public Optional<Location> resolve(List<String> urls) {
    List<DownloadCandidate> candidates = new ArrayList<>();
    for (String url : urls) {
      if (url == null || url.isBlank()) continue;
      DownloadCandidate candidate = DownloadCandidate.of(url);
      if (candidate.basename().isEmpty()) {
        log.debug("Skipping download candidate without a file name: {}", url);
        continue;
      }
      candidates.add(candidate);
    }
    if (candidates.isEmpty()) return Optional.empty();

    DownloadCandidate primary =
        candidates.stream()
            .filter(c -> c.scheme() == Scheme.S3)
            .findFirst()
            .orElse(candidates.get(0));
    String basename = primary.basename();
    String destinationName = basename.replace("/", "");

    if (primary.scheme() != Scheme.S3) {
      return Optional.of(Location.direct(primary, destinationName));
    }
    DownloadCandidate fallback =
        candidates.stream()
            .filter(c -> c != primary)
            .filter(c -> c.scheme() == Scheme.HTTPS)
            .filter(c -> c.basename().equals(basename))
            .findFirst()
            .orElse(null);
    return Optional.of(new Location(primary, fallback, destinationName));
  }

  /**
   * Resolve from the {@code OnlineAccessURL} node of granule metadata: an array of objects with a
   * {@code URL} field, or a single such object.
   */
  public Optional<Location> resolve(JsonNode onlineAccessUrls) {
    return resolve(urlsOf(onlineAccessUrls));
  }

  static List<String> urlsOf(JsonNode node) {
    List<String> urls = new ArrayList<>();
    if (node == null || node.isMissingNode() || node.isNull()) return urls;
    if (node.isObject()) {
      addUrl(node, urls);
    } else if (node.isArray()) {
      for (JsonNode entry : node) addUrl(entry, urls);
    }
    return urls;
  }

  private static void addUrl(JsonNode entry, List<String> urls) {
    JsonNode url = entry.get("URL");
    if (url != null && url.isTextual()) urls.add(url.asText());
  }
}
