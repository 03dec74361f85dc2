package nl.adgroot.pdfassistant.pdf;

import nl.adgroot.pdfassistant.IngestionException;

public class ExtractionException extends IngestionException {

  public ExtractionException(String message) {
    super(message);
  }

  public ExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
