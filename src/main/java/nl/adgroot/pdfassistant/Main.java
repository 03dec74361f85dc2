package nl.adgroot.pdfassistant;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import nl.adgroot.pdfassistant.config.AppConfig;
import nl.adgroot.pdfassistant.config.ConfigLoader;
import nl.adgroot.pdfassistant.conversation.CancellationToken;
import nl.adgroot.pdfassistant.conversation.ConversationLoop;
import nl.adgroot.pdfassistant.conversation.QuestionSource;
import nl.adgroot.pdfassistant.conversation.Speaker;
import nl.adgroot.pdfassistant.llm.LlmClient;
import nl.adgroot.pdfassistant.llm.LlmClientFactory;
import nl.adgroot.pdfassistant.llm.QuestionAnswerer;
import nl.adgroot.pdfassistant.pdf.DocumentStore;
import nl.adgroot.pdfassistant.pdf.PdfBoxDocumentMerger;
import nl.adgroot.pdfassistant.pdf.PdfBoxTextExtractor;
import nl.adgroot.pdfassistant.prompts.PromptTemplate;
import nl.adgroot.pdfassistant.session.IngestionReport;
import nl.adgroot.pdfassistant.session.IngestionSession;
import nl.adgroot.pdfassistant.web.DocumentFetcher;
import nl.adgroot.pdfassistant.web.HttpClients;
import nl.adgroot.pdfassistant.web.LinkDiscoverer;
import okhttp3.OkHttpClient;

/**
 * Console front end.
 *
 * <pre>
 *   java -jar pdf-question-assistant.jar [baseUrl]
 * </pre>
 *
 * Loads the PDFs linked from {@code baseUrl} (default: {@code source.baseUrl} in
 * config.json), then answers questions typed on stdin until "exit" or end of input.
 */
public class Main {

  public static void main(String[] args) throws Exception {
    AppConfig cfg = ConfigLoader.loadDefault();
    String baseUrl = args.length > 0 ? args[0] : cfg.source.baseUrl;

    String apiKey = ConfigLoader.resolveApiKey(cfg.llm, System.getenv());
    if (apiKey == null && "gemini".equalsIgnoreCase(cfg.llm.provider)) {
      System.err.println("No API key found; set the " + cfg.llm.apiKeyEnv + " environment variable.");
    }

    // init
    OkHttpClient http = HttpClients.create(cfg.http);
    DocumentStore store = new DocumentStore(Path.of(cfg.store.directory));
    DocumentStore outputStore = new DocumentStore(store.getDirectory().resolve(cfg.store.outputDirectory));
    LlmClient llm = LlmClientFactory.create(cfg.llm, apiKey);
    PromptTemplate promptTemplate = PromptTemplate.loadResource("prompt.txt");

    IngestionSession session = new IngestionSession(
        new LinkDiscoverer(http),
        new DocumentFetcher(http, store),
        new PdfBoxDocumentMerger(outputStore),
        new PdfBoxTextExtractor(),
        new QuestionAnswerer(llm, promptTemplate),
        cfg.store.mergedFileName
    );

    Speaker speaker = text -> System.out.println("Robot: " + text);
    BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

    try (AppExecutors exec = AppExecutors.create()) {
      System.out.println("Loading PDFs from " + baseUrl + " using " + llm.getModel() + " ...");
      CompletableFuture<IngestionReport> ingestion = session.runIngestionAsync(baseUrl, exec.ingestionWorker());

      try {
        ingestion.join();
        speaker.speak("PDFs merged and text extracted successfully. You can now ask questions about the content.");
      } catch (CompletionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        speaker.speak("Failed to load the PDFs: " + cause.getMessage());
      }

      QuestionSource questions = () -> {
        System.out.print("You: ");
        System.out.flush();
        try {
          String line = stdin.readLine();
          return line == null ? "exit" : line;
        } catch (IOException e) {
          System.err.println("Could not read from stdin: " + e.getMessage());
          return "exit";
        }
      };

      CancellationToken token = new CancellationToken();
      Runtime.getRuntime().addShutdownHook(new Thread(token::cancel, "stop-conversation"));

      int answered = new ConversationLoop(session, questions, speaker).run(token);
      System.out.println("Done. Answered " + answered + " questions.");
    }
  }
}
