package nl.adgroot.pdfassistant.pdf;

import nl.adgroot.pdfassistant.IngestionException;

/** None of the inputs of a merge could be read, so no output was written. */
public class MergeException extends IngestionException {

  public MergeException(String message) {
    super(message);
  }

  public MergeException(String message, Throwable cause) {
    super(message, cause);
  }
}
