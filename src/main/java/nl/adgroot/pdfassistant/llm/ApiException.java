package nl.adgroot.pdfassistant.llm;

import java.io.IOException;

/** A language-model call failed: bad status, unreadable body or missing credential. */
public class ApiException extends IOException {

  private final int statusCode;

  public ApiException(String message) {
    this(message, -1);
  }

  public ApiException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
