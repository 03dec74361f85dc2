package nl.adgroot.pdfassistant.session;

import org.jetbrains.annotations.NotNull;

/** Outcome of a successful ingestion run, used as the front end's status message. */
public record IngestionReport(
    String baseUrl,
    int discovered,
    int fetched,
    int skipped,
    int mergedPages,
    int contextLength
) {

  @NotNull
  @Override
  public String toString() {
    return String.format(
        "Found %d PDF links on %s, fetched %d (%d skipped), merged %d pages, extracted %d characters.",
        discovered, baseUrl, fetched, skipped, mergedPages, contextLength);
  }
}
