package nl.adgroot.pdfassistant.web;

import nl.adgroot.pdfassistant.IngestionException;

/** The page scanned for PDF links could not be retrieved. */
public class FetchException extends IngestionException {

  private final int statusCode;

  public FetchException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public FetchException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /** HTTP status of the failed response, or -1 for transport failures. */
  public int getStatusCode() {
    return statusCode;
  }
}
