package org.maap.client.retrieval;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LocationResolverTest {

  private final LocationResolver resolver = new LocationResolver();

  @Test
  void prefersS3AndPicksHttpsFallbackWithSameBasename() {
    Location loc =
        resolver
            .resolve(
                List.of(
                    "https://data.host/path/file.h5.sha256",
                    "https://data.host/path/file.h5",
                    "s3://bucket/path/file.h5"))
            .orElseThrow();

    assertEquals(Scheme.S3, loc.primary().scheme());
    assertEquals("s3://bucket/path/file.h5", loc.primary().url());
    assertEquals("https://data.host/path/file.h5", loc.fallback().url());
    assertEquals("file.h5", loc.destinationName());
    assertTrue(loc.hasDistinctFallback());
  }

  @Test
  void s3WithoutMatchingHttpsHasNoFallback() {
    Location loc =
        resolver
            .resolve(List.of("s3://bucket/a/file.h5", "https://host/a/other.h5"))
            .orElseThrow();

    assertTrue(loc.fallbackCandidate().isEmpty());
    assertFalse(loc.hasDistinctFallback());
  }

  @Test
  void nonS3PrimaryIsItsOwnFallback() {
    Location loc =
        resolver.resolve(List.of("ftp://ftp.host/pub/x.nc", "https://host/x.nc")).orElseThrow();

    assertEquals(Scheme.FTP, loc.primary().scheme());
    assertEquals(loc.primary(), loc.fallback());
    assertEquals("x.nc", loc.destinationName());
  }

  @Test
  void basenameIgnoresQueryString() {
    Location loc =
        resolver.resolve(List.of("https://host/data/granule.tif?token=abc#frag")).orElseThrow();

    assertEquals("granule.tif", loc.destinationName());
  }

  @Test
  void candidatesWithoutFileNameAreSkipped() {
    Location loc =
        resolver
            .resolve(List.of("https://host/dir/", "s3://bucket/dir/", "https://host/dir/f.h5"))
            .orElseThrow();

    assertEquals("https://host/dir/f.h5", loc.primary().url());
    assertEquals("f.h5", loc.destinationName());
    assertTrue(resolver.resolve(List.of("https://host/dir/", "https://host")).isEmpty());
  }

  @Test
  void noUrlsMeansNoLocation() {
    assertEquals(Optional.empty(), resolver.resolve(List.of()));
  }

  @Test
  void acceptsSingleObjectOrArrayMetadata() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    Location single =
        resolver.resolve(mapper.readTree("{\"URL\":\"https://host/one.h5\"}")).orElseThrow();
    Location many =
        resolver
            .resolve(
                mapper.readTree(
                    "[{\"URL\":\"https://host/two.h5\"},{\"URL\":\"s3://b/two.h5\"}]"))
            .orElseThrow();

    assertEquals("one.h5", single.destinationName());
    assertEquals("s3://b/two.h5", many.primary().url());
    assertEquals("https://host/two.h5", many.fallback().url());
    assertTrue(resolver.resolve(mapper.missingNode()).isEmpty());
  }
}
