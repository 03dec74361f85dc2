package nl.adgroot.pdfassistant;

/**
 * Base type for failures raised while turning a web page into question-answering context.
 *
 * <p>Subclasses thrown out of {@code IngestionSession#runIngestion} abort the run.
 * {@link nl.adgroot.pdfassistant.web.DownloadException} is the exception: it only ever
 * describes one skipped resource.
 */
public class IngestionException extends Exception {

  public IngestionException(String message) {
    super(message);
  }

  public IngestionException(String message, Throwable cause) {
    super(message, cause);
  }
}
