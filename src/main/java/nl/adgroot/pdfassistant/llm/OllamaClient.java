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

/** Client for a local Ollama server ({@code POST /api/generate}, non-streaming). */
public class OllamaClient implements LlmClient {

  private static final MediaType JSON = MediaType.parse("application/json");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final String url;
  private final String model;
  private final double temperature;

  public OllamaClient(OkHttpClient http, String url, String model, double temperature) {
    this.http = http;
    this.url = url;
    this.model = model;
    this.temperature = temperature;
  }

  @Override
  public CompletableFuture<LlmResult> generateAsync(String prompt) {
    ObjectNode req = MAPPER.createObjectNode();
    req.put("model", model);
    req.put("prompt", prompt);
    req.put("stream", false);
    req.putObject("options").put("temperature", temperature);

    Request request = new Request.Builder()
        .url(url)
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
                new ApiException("Ollama error: " + r.code() + " " + r.message() + "\n" + body, r.code())
            );
            return;
          }

          String body = Objects.requireNonNull(r.body()).string();
          JsonNode json = MAPPER.readTree(body);

          String response = json.path("response").asText("");
          long totalNs = json.path("total_duration").asLong(System.nanoTime() - startNs);
          LlmMetrics metrics = new LlmMetrics(
              totalNs,
              json.path("prompt_eval_count").asInt(),
              json.path("eval_count").asInt()
          );

          future.complete(new LlmResult(response, metrics));
        } catch (Exception e) {
          future.completeExceptionally(e);
        }
      }
    });

    return future;
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
