package nl.adgroot.pdfassistant.llm;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import nl.adgroot.pdfassistant.FakeHttp;
import org.junit.jupiter.api.Test;

class GeminiClientTest {

  private static final String BASE = "https://llm.example.test";
  private static final String ENDPOINT = BASE + "/v1beta/models/gemini-1.5-flash:generateContent";

  private final FakeHttp http = new FakeHttp();

  @Test
  void generateAsync_postsPromptWithKeyHeader_andJoinsCandidateParts() throws Exception {
    http.json(ENDPOINT, 200, """
        {
          "candidates": [
            {"content": {"role": "model", "parts": [{"text": "The meeting "}, {"text": "is at 3pm."}]}}
          ],
          "usageMetadata": {"promptTokenCount": 12, "candidatesTokenCount": 5}
        }
        """);
    GeminiClient client = new GeminiClient(http.client(), BASE + "/", "gemini-1.5-flash", "secret", 0.3);

    LlmResult result = client.generateAsync("Context: x\n\nQuestion: y").get(5, TimeUnit.SECONDS);

    assertEquals("The meeting is at 3pm.", result.response());
    assertEquals(12, result.metrics().promptTokenCount());
    assertEquals(5, result.metrics().responseTokenCount());

    FakeHttp.Recorded recorded = http.requests().get(0);
    assertEquals("POST", recorded.request().method());
    assertEquals("secret", recorded.request().header("x-goog-api-key"));
    assertNull(recorded.request().url().queryParameter("key"), "key must not be in the URL");

    JsonNode body = new ObjectMapper().readTree(recorded.body());
    assertEquals("Context: x\n\nQuestion: y", body.path("contents").path(0).path("parts").path(0).path("text").asText());
  }

  @Test
  void generateAsync_errorStatus_failsWithApiExceptionCarryingProviderMessage() {
    http.json(ENDPOINT, 400, "{\"error\": {\"code\": 400, \"message\": \"The input token count exceeds the maximum\"}}");
    GeminiClient client = new GeminiClient(http.client(), BASE, "gemini-1.5-flash", "secret", 0.3);

    ExecutionException e = assertThrows(ExecutionException.class,
        () -> client.generateAsync("p").get(5, TimeUnit.SECONDS));

    ApiException api = assertInstanceOf(ApiException.class, e.getCause());
    assertEquals(400, api.getStatusCode());
    assertTrue(api.getMessage().contains("exceeds the maximum"));
  }

  @Test
  void generateAsync_noCandidates_returnsEmptyResponse() throws Exception {
    http.json(ENDPOINT, 200, "{\"promptFeedback\": {\"blockReason\": \"SAFETY\"}}");
    GeminiClient client = new GeminiClient(http.client(), BASE, "gemini-1.5-flash", "secret", 0.3);

    assertEquals("", client.generateAsync("p").get(5, TimeUnit.SECONDS).response());
  }

  @Test
  void generateAsync_transportFailure_completesExceptionally() {
    http.fail(ENDPOINT, new IOException("unreachable"));
    GeminiClient client = new GeminiClient(http.client(), BASE, "gemini-1.5-flash", "secret", 0.3);

    ExecutionException e = assertThrows(ExecutionException.class,
        () -> client.generateAsync("p").get(5, TimeUnit.SECONDS));
    assertEquals("unreachable", e.getCause().getMessage());
  }

  @Test
  void generateAsync_missingKey_failsWithoutNetworkCall() {
    GeminiClient client = new GeminiClient(http.client(), BASE, "gemini-1.5-flash", null, 0.3);

    ExecutionException e = assertThrows(ExecutionException.class, () -> client.generateAsync("p").get());

    assertInstanceOf(ApiException.class, e.getCause());
    assertTrue(http.requests().isEmpty());
  }
}
