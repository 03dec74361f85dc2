package nl.adgroot.pdfassistant.session;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import nl.adgroot.pdfassistant.IngestionException;
import nl.adgroot.pdfassistant.llm.QuestionAnswerer;
import nl.adgroot.pdfassistant.pdf.ExtractionException;
import nl.adgroot.pdfassistant.pdf.LocalDocument;
import nl.adgroot.pdfassistant.pdf.MergedDocument;
import nl.adgroot.pdfassistant.pdf.PdfBoxDocumentMerger;
import nl.adgroot.pdfassistant.pdf.PdfBoxTextExtractor;
import nl.adgroot.pdfassistant.web.DocumentFetcher;
import nl.adgroot.pdfassistant.web.LinkDiscoverer;
import nl.adgroot.pdfassistant.web.NoDocumentsException;

/**
 * Holds the question-answering context produced by the last ingestion run.
 *
 * <p>State moves {@code EMPTY -> INGESTING -> READY}, and back to {@code EMPTY} when a
 * run fails; a failed run discards whatever context was loaded before. Runs are
 * serialized. State and context live in one immutable snapshot that is swapped
 * atomically, so {@link #ask(String)} always answers against a single context.
 */
public class IngestionSession {

  public static final String NOT_READY_RESPONSE =
      "You are not in PDF mode. Please load the PDFs first.";

  private record Snapshot(SessionState state, String context) {}

  private static final Snapshot EMPTY = new Snapshot(SessionState.EMPTY, "");

  private final LinkDiscoverer discoverer;
  private final DocumentFetcher fetcher;
  private final PdfBoxDocumentMerger merger;
  private final PdfBoxTextExtractor extractor;
  private final QuestionAnswerer answerer;
  private final String mergedFileName;

  private final ReentrantLock ingestionLock = new ReentrantLock();
  private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(EMPTY);

  public IngestionSession(
      LinkDiscoverer discoverer,
      DocumentFetcher fetcher,
      PdfBoxDocumentMerger merger,
      PdfBoxTextExtractor extractor,
      QuestionAnswerer answerer,
      String mergedFileName
  ) {
    this.discoverer = discoverer;
    this.fetcher = fetcher;
    this.merger = merger;
    this.extractor = extractor;
    this.answerer = answerer;
    this.mergedFileName = mergedFileName;
  }

  /**
   * Discovers, downloads, merges and extracts the PDFs linked from {@code baseUrl}, then
   * makes the extracted text the active context.
   *
   * @throws IngestionException if any run-level step fails; the session is then EMPTY
   */
  public IngestionReport runIngestion(String baseUrl) throws IngestionException {
    ingestionLock.lock();
    boolean succeeded = false;
    try {
      snapshot.set(new Snapshot(SessionState.INGESTING, ""));
      System.out.println("Starting PDF download and merge from " + baseUrl);

      List<String> pdfUrls = discoverer.discover(baseUrl);
      if (pdfUrls.isEmpty()) {
        throw new NoDocumentsException("No PDF links found on " + baseUrl);
      }

      AtomicInteger skipped = new AtomicInteger();
      List<LocalDocument> docs = fetcher.fetch(pdfUrls, e -> {
        skipped.incrementAndGet();
        System.err.println("Failed to download " + e.getUrl() + ": " + e.getMessage());
      });

      MergedDocument merged = merger.merge(docs, mergedFileName);

      String text = extractor.extract(merged);
      if (text.isEmpty()) {
        throw new ExtractionException("No text could be extracted from " + merged.path().getFileName());
      }

      snapshot.set(new Snapshot(SessionState.READY, text));
      succeeded = true;

      IngestionReport report = new IngestionReport(
          baseUrl, pdfUrls.size(), docs.size(), skipped.get(), merged.pageCount(), text.length());
      System.out.println(report);
      return report;
    } catch (IngestionException | RuntimeException e) {
      System.err.println("Ingestion of " + baseUrl + " failed: " + e.getMessage());
      throw e;
    } finally {
      // also covers Errors thrown from PDF parsing
      if (!succeeded) {
        snapshot.set(EMPTY);
      }
      ingestionLock.unlock();
    }
  }

  /** Runs {@link #runIngestion(String)} on {@code worker}; failures complete the future exceptionally. */
  public CompletableFuture<IngestionReport> runIngestionAsync(String baseUrl, Executor worker) {
    return CompletableFuture.supplyAsync(() -> {
      try {
        return runIngestion(baseUrl);
      } catch (IngestionException e) {
        throw new CompletionException(e);
      }
    }, worker);
  }

  /**
   * Answers {@code question} against the current context, or returns
   * {@link #NOT_READY_RESPONSE} without calling the model when no context is loaded.
   */
  public String ask(String question) {
    Snapshot current = snapshot.get();
    if (current.state() != SessionState.READY) {
      return NOT_READY_RESPONSE;
    }
    return answerer.answer(current.context(), question);
  }

  public SessionState state() {
    return snapshot.get().state();
  }

  public boolean isReady() {
    return state() == SessionState.READY;
  }

  /** The active context; empty unless READY. */
  public String context() {
    return snapshot.get().context();
  }
}
