package org.maap.client.retrieval;

import java.io.IOException;
import java.nio.file.Path;

/** Fetches one object from S3 to a local file that does not exist yet. */
public interface S3ObjectFetcher {
  void fetch(S3Object object, Path target) throws IOException;

  /** Bucket and key of an {@code s3://} URL. */
  record S3Object(String bucket, String key) {
    private static final String PREFIX = "s3://";

    /**
     * Parse {@code s3://bucket/key}. Path-style URLs whose authority is an S3 endpoint host
     * ({@code s3://s3.amazonaws.com:80/bucket/key}) take the bucket from the first path segment.
     */
    public static S3Object parse(String url) {
      if (url == null || !url.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
        throw new IllegalArgumentException("Not an s3 URL: " + url);
      }
      String rest = url.substring(PREFIX.length());
      int slash = rest.indexOf('/');
      String authority = slash < 0 ? rest : rest.substring(0, slash);
      String path = slash < 0 ? "" : rest.substring(slash + 1);
      if (isEndpointHost(authority)) {
        int next = path.indexOf('/');
        if (next > 0) {
          return new S3Object(path.substring(0, next), path.substring(next + 1));
        }
      }
      if (authority.isEmpty() || path.isEmpty()) {
        throw new IllegalArgumentException("s3 URL lacks bucket or key: " + url);
      }
      return new S3Object(authority, path);
    }

    private static boolean isEndpointHost(String authority) {
      int colon = authority.indexOf(':');
      String host = colon < 0 ? authority : authority.substring(0, colon);
      return host.equals("s3.amazonaws.com")
          || (host.startsWith("s3.") && host.endsWith(".amazonaws.com"));
    }
  }
}
