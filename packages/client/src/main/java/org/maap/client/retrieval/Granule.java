package org.maap.client.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One data file of a catalog collection.
 *
 * @param resolvedLocation nullable; see {@link #location()}
 * @param opendapUrl nullable
 * @param browseUrl nullable
 */
public record Granule(
    JsonNode metadata,
    Location resolvedLocation,
    List<String> relatedUrls,
    String opendapUrl,
    String browseUrl)
    implements SearchResult {

  private static final String OPENDAP = "OPeNDAP";
  private static final String BROWSE = "BROWSE";

  public Granule {
    Objects.requireNonNull(metadata, "metadata");
    relatedUrls = relatedUrls == null ? List.of() : List.copyOf(relatedUrls);
  }

  /** Build from a granule metadata record ({@code {"Granule": {...}, ...}}). */
  public static Granule fromMetadata(JsonNode metadata, LocationResolver resolver) {
    JsonNode granule = metadata.path("Granule");
    List<String> urls =
        LocationResolver.urlsOf(granule.path("OnlineAccessURLs").path("OnlineAccessURL"));
    Location location = resolver.resolve(urls).orElse(null);

    String opendap = null;
    String browse = null;
    JsonNode resources = granule.path("OnlineResources").path("OnlineResource");
    Iterable<JsonNode> entries = resources.isObject() ? List.of(resources) : resources;
    for (JsonNode resource : entries) {
      String type = resource.path("Type").asText("");
      String url = resource.path("URL").asText(null);
      if (opendap == null && OPENDAP.equalsIgnoreCase(type)) opendap = url;
      if (browse == null && BROWSE.equalsIgnoreCase(type)) browse = url;
    }
    return new Granule(metadata, location, urls, opendap, browse);
  }

  @Override
  public Optional<Location> location() {
    return Optional.ofNullable(resolvedLocation);
  }

  public Optional<String> opendap() {
    return Optional.ofNullable(opendapUrl);
  }

  public Optional<String> browse() {
    return Optional.ofNullable(browseUrl);
  }

  /**
   * The primary URL when {@code s3} is set; otherwise an https URL: the fallback if one was
   * listed, else the virtual-hosted S3 address of the primary.
   */
  public Optional<String> downloadUrl(boolean s3) {
    return location()
        .map(
            loc -> {
              if (s3) return loc.primary().url();
              if (loc.primary().scheme() != Scheme.S3) return loc.primary().url();
              if (loc.hasDistinctFallback()) return loc.fallback().url();
              return s3ToHttps(loc.primary().url());
            });
  }

  /** {@code GranuleUR} padded to 70 columns, last update and collection concept id. */
  public String description() {
    JsonNode granule = metadata.path("Granule");
    return String.format(
        "%-70s Updated %s (%s)",
        granule.path("GranuleUR").asText(""),
        granule.path("LastUpdate").asText(""),
        metadata.path("collection-concept-id").asText(""));
  }

  static String s3ToHttps(String url) {
    String rest = url.substring("s3://".length());
    int slash = rest.indexOf('/');
    if (slash < 0) return "https://" + rest + ".s3.amazonaws.com";
    return "https://" + rest.substring(0, slash) + ".s3.amazonaws.com" + rest.substring(slash);
  }
}
