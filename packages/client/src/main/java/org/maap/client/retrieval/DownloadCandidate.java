package org.maap.client.retrieval;

import java.util.Objects;

/** One listed location of a data object. */
public record DownloadCandidate(Scheme scheme, String url) {

  public DownloadCandidate {
    Objects.requireNonNull(scheme, "scheme");
    Objects.requireNonNull(url, "url");
  }

  public static DownloadCandidate of(String url) {
    String trimmed = Objects.requireNonNull(url, "url").trim();
    return new DownloadCandidate(Scheme.of(trimmed), trimmed);
  }

  /** Final segment of the URL path, ignoring any query or fragment. */
  public String basename() {
    return basename(url);
  }

  static String basename(String url) {
    String path = url;
    int schemeEnd = path.indexOf("://");
    if (schemeEnd >= 0) {
      int pathStart = path.indexOf('/', schemeEnd + 3);
      path = pathStart < 0 ? "" : path.substring(pathStart);
    }
    int cut = indexOfAny(path, '?', '#');
    if (cut >= 0) path = path.substring(0, cut);
    return path.substring(path.lastIndexOf('/') + 1);
  }

  private static int indexOfAny(String s, char a, char b) {
    int i = s.indexOf(a);
    int j = s.indexOf(b);
    if (i < 0) return j;
    if (j < 0) return i;
    return Math.min(i, j);
  }
}
