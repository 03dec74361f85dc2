package nl.adgroot.pdfassistant.conversation;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import nl.adgroot.pdfassistant.FakeHttp;
import nl.adgroot.pdfassistant.StubLlmClient;
import nl.adgroot.pdfassistant.TestPdfs;
import nl.adgroot.pdfassistant.llm.QuestionAnswerer;
import nl.adgroot.pdfassistant.pdf.DocumentStore;
import nl.adgroot.pdfassistant.pdf.PdfBoxDocumentMerger;
import nl.adgroot.pdfassistant.pdf.PdfBoxTextExtractor;
import nl.adgroot.pdfassistant.session.IngestionSession;
import nl.adgroot.pdfassistant.web.DocumentFetcher;
import nl.adgroot.pdfassistant.web.LinkDiscoverer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConversationLoopTest {

  private static final String PAGE = "https://example.org/";

  @TempDir
  Path tmp;

  private final FakeHttp http = new FakeHttp();
  private final List<String> spoken = new ArrayList<>();

  @Test
  void run_answersEachQuestionUntilStopWord() throws Exception {
    StubLlmClient llm = StubLlmClient.answering("At 3pm.");
    IngestionSession session = readySession(llm);

    int answered = new ConversationLoop(session, script("When?", "Where?", "exit", "never asked"), spoken::add)
        .run(new CancellationToken());

    assertEquals(2, answered);
    assertEquals(List.of("At 3pm.", "At 3pm."), spoken);
    assertEquals(2, llm.prompts().size());
  }

  @Test
  void run_stopWord_cancelsTheToken() throws Exception {
    CancellationToken token = new CancellationToken();

    new ConversationLoop(readySession(StubLlmClient.answering("x")), script("STOP"), spoken::add).run(token);

    assertTrue(token.isCancelled());
    assertTrue(spoken.isEmpty());
  }

  @Test
  void run_unrecognizedInput_isReportedAndTheLoopContinues() throws Exception {
    IngestionSession session = readySession(StubLlmClient.answering("fine"));

    int answered = new ConversationLoop(session, script(null, "  ", "ok?", "quit"), spoken::add)
        .run(new CancellationToken());

    assertEquals(1, answered);
    assertEquals(List.of(ConversationLoop.NOT_UNDERSTOOD, ConversationLoop.NOT_UNDERSTOOD, "fine"), spoken);
  }

  @Test
  void run_sessionNotReady_speaksNotReadyResponse() throws Exception {
    StubLlmClient llm = StubLlmClient.answering("x");
    IngestionSession session = newSession(llm);

    new ConversationLoop(session, script("hello?", "exit"), spoken::add).run(new CancellationToken());

    assertEquals(List.of(IngestionSession.NOT_READY_RESPONSE), spoken);
    assertTrue(llm.prompts().isEmpty());
  }

  @Test
  void run_alreadyCancelled_asksNothing() throws Exception {
    CancellationToken token = new CancellationToken();
    token.cancel();
    Deque<String> questions = new ArrayDeque<>(List.of("q"));

    int answered = new ConversationLoop(newSession(StubLlmClient.answering("x")), questions::poll, spoken::add)
        .run(token);

    assertEquals(0, answered);
    assertEquals(1, questions.size());
  }

  @Test
  void run_tokenCancelledByFrontEndBetweenTurns_stopsAfterCurrentAnswer() throws Exception {
    CancellationToken token = new CancellationToken();
    IngestionSession session = readySession(StubLlmClient.answering("first"));
    Speaker cancellingSpeaker = text -> {
      spoken.add(text);
      token.cancel();
    };

    int answered = new ConversationLoop(session, script("a?", "b?"), cancellingSpeaker).run(token);

    assertEquals(1, answered);
    assertEquals(List.of("first"), spoken);
  }

  // ---------------- helpers ----------------

  private static QuestionSource script(String... lines) {
    Deque<String> queue = new ArrayDeque<>();
    List<String> all = Arrays.asList(lines);
    // ArrayDeque rejects null, so keep nulls as a marker
    all.forEach(l -> queue.add(l == null ? "\u0000" : l));
    return () -> {
      String next = queue.poll();
      if (next == null) return "exit";
      return next.equals("\u0000") ? null : next;
    };
  }

  private IngestionSession readySession(StubLlmClient llm) throws Exception {
    http.html(PAGE, "<a href='doc.pdf'>doc</a>");
    http.pdf(PAGE + "doc.pdf", TestPdfs.withPages("The meeting is at 3pm."));
    IngestionSession session = newSession(llm);
    session.runIngestion(PAGE);
    return session;
  }

  private IngestionSession newSession(StubLlmClient llm) throws IOException {
    DocumentStore store = new DocumentStore(tmp.resolve("pdfs"));
    return new IngestionSession(
        new LinkDiscoverer(http.client()),
        new DocumentFetcher(http.client(), store),
        new PdfBoxDocumentMerger(new DocumentStore(store.getDirectory().resolve("merged"))),
        new PdfBoxTextExtractor(),
        new QuestionAnswerer(llm),
        "merged.pdf"
    );
  }
}
