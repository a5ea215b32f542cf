package org.maap.client.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/** A catalog collection; downloading it fetches its UMM JSON record. */
public record Collection(JsonNode metadata, Location resolvedLocation) implements SearchResult {

  public Collection {
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(resolvedLocation, "resolvedLocation");
  }

  public static Collection fromMetadata(JsonNode metadata, String apiHost) {
    String conceptId = metadata.path("concept-id").asText("");
    if (conceptId.isBlank()) {
      throw new IllegalArgumentException("Collection metadata has no concept-id");
    }
    String url = "https://" + apiHost + "/search/concepts/" + conceptId + ".umm-json";
    String name = metadata.path("Collection").path("ShortName").asText(conceptId).replace("/", "");
    return new Collection(metadata, Location.direct(DownloadCandidate.of(url), name));
  }

  public String conceptId() {
    return metadata.path("concept-id").asText();
  }

  @Override
  public Optional<Location> location() {
    return Optional.of(resolvedLocation);
  }
}
