package nl.adgroot.pdfassistant.web;

import java.time.Duration;
import nl.adgroot.pdfassistant.config.AppConfig;
import okhttp3.OkHttpClient;

public final class HttpClients {

  private HttpClients() {
    // utility class
  }

  /**
   * Client shared by link discovery and document download. Every call is bounded by
   * explicit timeouts; the OkHttp defaults leave the overall call unbounded.
   */
  public static OkHttpClient create(AppConfig.HttpConfig cfg) {
    String userAgent = cfg.userAgent;

    return new OkHttpClient.Builder()
        .connectTimeout(Duration.ofSeconds(cfg.connectTimeoutSeconds))
        .readTimeout(Duration.ofSeconds(cfg.readTimeoutSeconds))
        .writeTimeout(Duration.ofSeconds(cfg.writeTimeoutSeconds))
        .callTimeout(Duration.ofSeconds(cfg.callTimeoutSeconds))
        .followRedirects(true)
        .addInterceptor(chain -> {
          if (userAgent == null || userAgent.isBlank()) {
            return chain.proceed(chain.request());
          }
          return chain.proceed(chain.request().newBuilder()
              .header("User-Agent", userAgent)
              .build());
        })
        .build();
  }
}
