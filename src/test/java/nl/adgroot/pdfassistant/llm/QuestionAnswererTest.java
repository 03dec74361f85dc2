package nl.adgroot.pdfassistant.llm;

import static org.junit.jupiter.api.Assertions.*;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import nl.adgroot.pdfassistant.StubLlmClient;
import nl.adgroot.pdfassistant.prompts.PromptTemplate;
import org.junit.jupiter.api.Test;

class QuestionAnswererTest {

  @Test
  void answer_sendsContextAndQuestionInFixedTemplate() {
    StubLlmClient llm = StubLlmClient.answering("At 3pm.");

    String answer = new QuestionAnswerer(llm).answer("The meeting is at 3pm.", "When is the meeting?");

    assertEquals("At 3pm.", answer);
    assertEquals(List.of("Context: The meeting is at 3pm.\n\nQuestion: When is the meeting?"), llm.prompts());
  }

  @Test
  void answer_providerError_becomesErrorString() {
    StubLlmClient llm = StubLlmClient.failingWith(new ApiException("Gemini error: 400 input too long", 400));

    String answer = new QuestionAnswerer(llm).answer("ctx", "q");

    assertEquals("Error: Gemini error: 400 input too long", answer);
  }

  @Test
  void answer_transportErrorWithoutMessage_usesExceptionType() {
    StubLlmClient llm = StubLlmClient.failingWith(new SocketTimeoutException());

    assertEquals("Error: SocketTimeoutException", new QuestionAnswerer(llm).answer("ctx", "q"));
  }

  @Test
  void answer_emptyResponse_becomesNoResponseGenerated() {
    assertEquals(QuestionAnswerer.NO_RESPONSE, new QuestionAnswerer(StubLlmClient.answering("")).answer("c", "q"));
    assertEquals(QuestionAnswerer.NO_RESPONSE, new QuestionAnswerer(StubLlmClient.answering(null)).answer("c", "q"));
  }

  @Test
  void answer_clientThrowingSynchronously_neverEscapes() {
    StubLlmClient llm = new StubLlmClient(p -> {
      throw new IllegalStateException("client closed");
    });

    assertEquals("Error: client closed", new QuestionAnswerer(llm).answer("c", "q"));
  }

  @Test
  void answer_interrupted_restoresInterruptFlag() {
    StubLlmClient llm = new StubLlmClient(p -> new CompletableFuture<>());
    Thread.currentThread().interrupt();
    try {
      String answer = new QuestionAnswerer(llm).answer("c", "q");

      assertTrue(answer.startsWith(QuestionAnswerer.ERROR_PREFIX));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void answer_usesCustomTemplate() {
    StubLlmClient llm = StubLlmClient.answering("ok");

    new QuestionAnswerer(llm, new PromptTemplate("Q={{question}} C={{context}}")).answer("ctx", "why?");

    assertEquals("Q=why? C=ctx", llm.prompts().get(0));
  }
}
