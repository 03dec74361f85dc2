package nl.adgroot.pdfassistant.web;

import nl.adgroot.pdfassistant.IngestionException;

public class NoDocumentsException extends IngestionException {

  public NoDocumentsException(String message) {
    super(message);
  }
}
