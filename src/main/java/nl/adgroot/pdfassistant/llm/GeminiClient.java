package nl.adgroot.pdfassistant.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Client for the Google Generative Language API ({@code models/{model}:generateContent}).
 *
 * <p>The key travels in the {@code x-goog-api-key} header, never in the URL.
 */
public class GeminiClient implements LlmClient {

  private static final MediaType JSON = MediaType.parse("application/json");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final String url;
  private final String model;
  private final String apiKey;
  private final double temperature;

  public GeminiClient(OkHttpClient http, String baseUrl, String model, String apiKey, double temperature) {
    this.http = http;
    this.url = stripTrailingSlash(baseUrl) + "/v1beta/models/" + model + ":generateContent";
    this.model = model;
    this.apiKey = apiKey;
    this.temperature = temperature;
  }

  @Override
  public CompletableFuture<LlmResult> generateAsync(String prompt) {
    if (apiKey == null || apiKey.isBlank()) {
      return CompletableFuture.failedFuture(new ApiException("No API key configured for model " + model));
    }

    ObjectNode req = MAPPER.createObjectNode();
    req.putArray("contents")
        .addObject()
        .put("role", "user")
        .putArray("parts")
        .addObject()
        .put("text", prompt);
    req.putObject("generationConfig").put("temperature", temperature);

    Request request = new Request.Builder()
        .url(url)
        .header("x-goog-api-key", apiKey)
        .post(RequestBody.create(req.toString(), JSON))
        .build();

    CompletableFuture<LlmResult> future = new CompletableFuture<>();
    long startNs = System.nanoTime();

    http.newCall(request).enqueue(new Callback() {
      @Override
      public void onFailure(Call call, IOException e) {
        future.completeExceptionally(e);
      }

      @Override
      public void onResponse(Call call, Response resp) {
        try (Response r = resp) {
          if (!r.isSuccessful()) {
            String body = LlmClientFactory.readBodySafely(r.body());
            future.completeExceptionally(
                new ApiException("Gemini error: " + r.code() + " " + errorMessage(body, r.message()), r.code())
            );
            return;
          }

          String body = Objects.requireNonNull(r.body()).string();
          JsonNode json = MAPPER.readTree(body);

          JsonNode usage = json.path("usageMetadata");
          LlmMetrics metrics = new LlmMetrics(
              System.nanoTime() - startNs,
              usage.path("promptTokenCount").asInt(),
              usage.path("candidatesTokenCount").asInt()
          );

          future.complete(new LlmResult(firstCandidateText(json), metrics));
        } catch (Exception e) {
          future.completeExceptionally(e);
        }
      }
    });

    return future;
  }

  /** Concatenated text parts of the first candidate; empty when the model returned none. */
  static String firstCandidateText(JsonNode json) {
    JsonNode parts = json.path("candidates").path(0).path("content").path("parts");
    StringBuilder sb = new StringBuilder();
    for (JsonNode part : parts) {
      sb.append(part.path("text").asText(""));
    }
    return sb.toString();
  }

  private static String errorMessage(String body, String fallback) {
    if (body == null || body.isBlank()) return fallback;
    try {
      String msg = MAPPER.readTree(body).path("error").path("message").asText("");
      return msg.isBlank() ? body : msg;
    } catch (IOException e) {
      return body;
    }
  }

  private static String stripTrailingSlash(String s) {
    return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
  }

  @Override
  public String getUrl() {
    return url;
  }

  @Override
  public String getModel() {
    return model;
  }
}
