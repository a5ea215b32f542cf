package org.maap.client.retrieval;

import java.nio.file.Path;
import org.maap.client.config.MaapConfig;
import org.maap.client.exception.TransferException;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;

/** {@link S3ObjectFetcher} backed by the AWS SDK, using the default credential chain. */
public class AwsS3ObjectFetcher implements S3ObjectFetcher, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(AwsS3ObjectFetcher.class);

  private final S3Client s3;

  public AwsS3ObjectFetcher(MaapConfig config) {
    this(
        S3Client.builder()
            .region(Region.of(config.awsRegion()))
            .credentialsProvider(DefaultCredentialsProvider.create())
            .build());
  }

  public AwsS3ObjectFetcher(S3Client s3) {
    this.s3 = s3;
  }

  @Override
  public void fetch(S3Object object, Path target) {
    GetObjectRequest request =
        GetObjectRequest.builder().bucket(object.bucket()).key(object.key()).build();
    try {
      s3.getObject(request, ResponseTransformer.toFile(target));
      log.debug("Fetched s3://{}/{} to {}", object.bucket(), object.key(), target);
    } catch (SdkException e) {
      throw new TransferException(
          "S3 fetch of s3://" + object.bucket() + "/" + object.key() + " failed: " + e.getMessage(),
          e);
    }
  }

  @Override
  public void close() {
    s3.close();
  }
}
