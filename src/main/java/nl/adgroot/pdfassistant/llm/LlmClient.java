package nl.adgroot.pdfassistant.llm;

import java.util.concurrent.CompletableFuture;

/**
 * A hosted language model answering a single prompt. One request per call, no streaming
 * and no memory between calls.
 */
public interface LlmClient {

  /**
   * Sends {@code prompt} to the model. Failures (transport errors, non-2xx responses,
   * unreadable bodies, missing credentials) complete the future exceptionally, usually with
   * an {@link ApiException}.
   */
  CompletableFuture<LlmResult> generateAsync(String prompt);

  String getUrl();

  String getModel();
}
