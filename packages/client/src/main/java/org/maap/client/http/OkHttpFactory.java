package org.maap.client.http;

import okhttp3.OkHttpClient;
import org.maap.client.config.MaapConfig;

public class OkHttpFactory {

  public static OkHttpClient create(MaapConfig config) {
    if (config == null) {
      throw new IllegalArgumentException("MaapConfig cannot be null");
    }
    return new OkHttpClient.Builder()
        .connectTimeout(config.connectTimeout())
        .readTimeout(config.readTimeout())
        .followRedirects(true)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
