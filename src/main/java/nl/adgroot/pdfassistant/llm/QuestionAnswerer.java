package nl.adgroot.pdfassistant.llm;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import nl.adgroot.pdfassistant.prompts.PromptTemplate;

/**
 * Answers a question about a piece of context with one language-model call.
 *
 * <p>Never throws: a failed call becomes {@code "Error: <detail>"} and an empty reply
 * becomes {@link #NO_RESPONSE}, so a bad question cannot end a conversation. The context
 * is sent as-is; if it is too large the provider's rejection is what the caller sees.
 */
public class QuestionAnswerer {

  public static final String ERROR_PREFIX = "Error: ";
  public static final String NO_RESPONSE = "No response generated.";

  private final LlmClient llm;
  private final PromptTemplate promptTemplate;

  public QuestionAnswerer(LlmClient llm) {
    this(llm, PromptTemplate.questionAnswering());
  }

  public QuestionAnswerer(LlmClient llm, PromptTemplate promptTemplate) {
    this.llm = llm;
    this.promptTemplate = promptTemplate;
  }

  public String answer(String context, String question) {
    String prompt = promptTemplate.render(Map.of(
        "context", context == null ? "" : context,
        "question", question == null ? "" : question
    ));

    try {
      LlmResult result = llm.generateAsync(prompt).get();
      if (result == null || result.response() == null || result.response().isBlank()) {
        return NO_RESPONSE;
      }
      return result.response();
    } catch (ExecutionException e) {
      return error(e.getCause() != null ? e.getCause() : e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ERROR_PREFIX + "interrupted while waiting for " + llm.getModel();
    } catch (CompletionException e) {
      return error(e.getCause() != null ? e.getCause() : e);
    } catch (RuntimeException e) {
      return error(e);
    }
  }

  private static String error(Throwable t) {
    String detail = t.getMessage();
    if (detail == null || detail.isBlank()) {
      detail = t.getClass().getSimpleName();
    }
    return ERROR_PREFIX + detail;
  }
}
