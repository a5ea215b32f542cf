package org.maap.client.retrieval;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.maap.client.exception.TransferException;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Materializes a {@link Location} as a file in a destination directory.
 *
 * <p>An existing file is reused unless {@code overwrite} is set, without touching the network.
 * Bytes are written to {@code <name>.part} and renamed into place once complete, so an
 * interrupted transfer never leaves a truncated file under the final name.
 */
public class Retriever {
  private static final Logger log = LoggingService.getLogger(Retriever.class);

  static final String PARTIAL_SUFFIX = ".part";

  @FunctionalInterface
  interface Transfer {
    void writeTo(Path target) throws IOException;
  }

  private final S3ObjectFetcher s3;
  private final FtpFetcher ftp;
  private final HttpDownloader http;

  public Retriever(S3ObjectFetcher s3, FtpFetcher ftp, HttpDownloader http) {
    this.s3 = s3;
    this.ftp = ftp;
    this.http = http;
  }

  /**
   * @return path of the local file
   * @throws TransferException when the object could not be fetched from any listed location
   * @throws IOException when the destination cannot be written
   */
  public Path retrieve(Location location, Path destinationDir, boolean overwrite)
      throws IOException {
    Path destination = destinationDir.resolve(location.destinationName());
    if (Files.exists(destination) && !overwrite) {
      log.debug("{} already present, skipping download", destination);
      return destination;
    }
    Files.createDirectories(destinationDir);

    DownloadCandidate primary = location.primary();
    if (primary.scheme() != Scheme.S3) {
      stage(destination, fetcherFor(primary));
      return destination;
    }
    try {
      stage(destination, fetcherFor(primary));
    } catch (TransferException | IllegalArgumentException e) {
      if (!location.hasDistinctFallback()) {
        throw asTransferFailure(primary, e);
      }
      log.debug(
          "S3 fetch of {} failed ({}), falling back to {}",
          primary.url(),
          e.getMessage(),
          location.fallback().url());
      stage(destination, fetcherFor(location.fallback()));
    }
    return destination;
  }

  private Transfer fetcherFor(DownloadCandidate candidate) {
    String url = candidate.url();
    switch (candidate.scheme()) {
      case S3:
        return target -> s3.fetch(S3ObjectFetcher.S3Object.parse(url), target);
      case FTP:
        return target -> ftp.fetch(url, target);
      case HTTP:
      case HTTPS:
        return target -> http.download(url, target);
      default:
        throw new TransferException("Unsupported URL scheme: " + url);
    }
  }

  private static void stage(Path destination, Transfer transfer) throws IOException {
    Path partial = destination.resolveSibling(destination.getFileName() + PARTIAL_SUFFIX);
    Files.deleteIfExists(partial);
    boolean done = false;
    try {
      transfer.writeTo(partial);
      moveIntoPlace(partial, destination);
      done = true;
    } finally {
      if (!done) discard(partial);
    }
  }

  private static void moveIntoPlace(Path partial, Path destination) throws IOException {
    try {
      Files.move(
          partial,
          destination,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(partial, destination, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void discard(Path partial) {
    try {
      Files.deleteIfExists(partial);
    } catch (IOException e) {
      log.warn("Could not remove partial download {}: {}", partial, e.getMessage());
    }
  }

  private static TransferException asTransferFailure(
      DownloadCandidate primary, RuntimeException e) {
    if (e instanceof TransferException transfer) return transfer;
    return new TransferException("Cannot fetch " + primary.url() + ": " + e.getMessage(), e);
  }
}
