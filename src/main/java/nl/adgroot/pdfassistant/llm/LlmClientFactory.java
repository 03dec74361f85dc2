package nl.adgroot.pdfassistant.llm;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import nl.adgroot.pdfassistant.config.AppConfig;
import okhttp3.OkHttpClient;
import okhttp3.ResponseBody;

public final class LlmClientFactory {

  private LlmClientFactory() {
    // utility class
  }

  /**
   * Creates the client for the configured provider.
   *
   * Rules:
   * - provider "gemini" (default) calls {@code baseUrl}/v1beta/models/{model}:generateContent
   * - provider "ollama" calls http://{host}:{port}{generatePath}
   * - the api key is only used by gemini; a missing key surfaces on the first call
   */
  public static LlmClient create(AppConfig.LlmConfig cfg, String apiKey) {
    return create(cfg, apiKey, httpClient(cfg));
  }

  public static LlmClient create(AppConfig.LlmConfig cfg, String apiKey, OkHttpClient http) {
    String provider = cfg.provider == null ? "gemini" : cfg.provider.trim().toLowerCase(Locale.ROOT);

    switch (provider) {
      case "gemini":
        return new GeminiClient(http, cfg.baseUrl, cfg.model, apiKey, cfg.temperature);
      case "ollama":
        String url = "http://" + cfg.host + ":" + cfg.port + cfg.generatePath;
        return new OllamaClient(http, url, cfg.model, cfg.temperature);
      default:
        throw new IllegalArgumentException("Unknown llm.provider: " + cfg.provider);
    }
  }

  static OkHttpClient httpClient(AppConfig.LlmConfig cfg) {
    Duration t = Duration.ofSeconds(cfg.timeoutSeconds);

    return new OkHttpClient.Builder()
        .connectTimeout(t)
        .readTimeout(t)
        .writeTimeout(t)
        .callTimeout(t)
        .build();
  }

  static String readBodySafely(ResponseBody body) {
    if (body == null) return "";
    try {
      return body.string();
    } catch (IOException ignored) {
      return "";
    }
  }
}
