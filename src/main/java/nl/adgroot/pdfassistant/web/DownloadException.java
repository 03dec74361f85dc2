package nl.adgroot.pdfassistant.web;

import nl.adgroot.pdfassistant.IngestionException;

public class DownloadException extends IngestionException {

  private final String url;

  public DownloadException(String url, String message) {
    super(message);
    this.url = url;
  }

  public DownloadException(String url, String message, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  public String getUrl() {
    return url;
  }
}
