package org.maap.client.retrieval;

import java.io.IOException;
import java.nio.file.Path;

/** Fetches one {@code ftp://} URL to a local file. */
public interface FtpFetcher {
  void fetch(String url, Path target) throws IOException;
}
