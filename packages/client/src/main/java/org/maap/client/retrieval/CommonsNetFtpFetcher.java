package org.maap.client.retrieval;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Supplier;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.maap.client.exception.TransferException;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/** Anonymous (or URL-credentialed) passive-mode binary FTP download. */
public class CommonsNetFtpFetcher implements FtpFetcher {
  private static final Logger log = LoggingService.getLogger(CommonsNetFtpFetcher.class);

  private static final String ANONYMOUS = "anonymous";

  private final Duration timeout;
  private final Supplier<FTPClient> clients;

  public CommonsNetFtpFetcher(Duration timeout) {
    this(timeout, FTPClient::new);
  }

  CommonsNetFtpFetcher(Duration timeout, Supplier<FTPClient> clients) {
    this.timeout = timeout;
    this.clients = clients;
  }

  @Override
  public void fetch(String url, Path target) throws IOException {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new TransferException("Invalid ftp URL: " + url, e);
    }
    if (uri.getHost() == null || uri.getPath() == null || uri.getPath().isEmpty()) {
      throw new TransferException("ftp URL lacks host or path: " + url);
    }

    FTPClient ftp = clients.get();
    ftp.setConnectTimeout((int) timeout.toMillis());
    ftp.setDefaultTimeout((int) timeout.toMillis());
    try {
      ftp.connect(uri.getHost(), uri.getPort() > 0 ? uri.getPort() : FTP.DEFAULT_PORT);
      if (!FTPReply.isPositiveCompletion(ftp.getReplyCode())) {
        throw new TransferException("FTP server refused connection: " + ftp.getReplyString());
      }
      String user = ANONYMOUS;
      String password = ANONYMOUS + "@";
      if (uri.getUserInfo() != null) {
        String[] parts = uri.getUserInfo().split(":", 2);
        user = parts[0];
        password = parts.length > 1 ? parts[1] : "";
      }
      if (!ftp.login(user, password)) {
        throw new TransferException("FTP login failed: " + ftp.getReplyString());
      }
      ftp.enterLocalPassiveMode();
      ftp.setFileType(FTP.BINARY_FILE_TYPE);
      try (OutputStream out = Files.newOutputStream(target)) {
        if (!ftp.retrieveFile(uri.getPath(), out)) {
          throw new TransferException(
              "FTP retrieve of " + uri.getPath() + " failed: " + ftp.getReplyString());
        }
      }
      log.debug("Fetched {} to {}", url, target);
    } finally {
      close(ftp, uri.getHost());
    }
  }

  private static void close(FTPClient ftp, String host) {
    if (!ftp.isConnected()) return;
    try {
      ftp.logout();
    } catch (IOException e) {
      log.debug("FTP logout from {} failed: {}", host, e.getMessage());
    } finally {
      try {
        ftp.disconnect();
      } catch (IOException e) {
        log.debug("Error closing FTP connection to {}: {}", host, e.getMessage());
      }
    }
  }
}
