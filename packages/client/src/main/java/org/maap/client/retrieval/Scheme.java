package org.maap.client.retrieval;

import java.util.Locale;

/** URL schemes the retriever knows how to fetch. */
public enum Scheme {
  S3("s3://"),
  HTTPS("https://"),
  HTTP("http://"),
  FTP("ftp://"),
  UNSUPPORTED("");

  private final String prefix;

  Scheme(String prefix) {
    this.prefix = prefix;
  }

  public static Scheme of(String url) {
    if (url == null) return UNSUPPORTED;
    String lower = url.trim().toLowerCase(Locale.ROOT);
    for (Scheme s : values()) {
      if (s != UNSUPPORTED && lower.startsWith(s.prefix)) return s;
    }
    return UNSUPPORTED;
  }

  public boolean isHttp() {
    return this == HTTP || this == HTTPS;
  }
}
