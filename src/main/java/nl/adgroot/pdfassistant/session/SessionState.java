package nl.adgroot.pdfassistant.session;

public enum SessionState {
  /** No context loaded, or the last ingestion failed. */
  EMPTY,
  INGESTING,
  /** Context loaded; questions are answered. */
  READY
}
