package org.maap.client.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** A catalog search result that can be downloaded. */
public sealed interface SearchResult permits Granule, Collection {

  /** The metadata record as returned by the catalog. */
  JsonNode metadata();

  /** Where to download from; empty when the record lists no usable URL. */
  Optional<Location> location();

  /** File name the download is stored under, or {@code null} when there is no location. */
  default String downloadName() {
    return location().map(Location::destinationName).orElse(null);
  }
}
