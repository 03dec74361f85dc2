package nl.adgroot.pdfassistant.pdf;

import java.nio.file.Path;
import org.jetbrains.annotations.NotNull;

/** A downloaded PDF in the document store, identified by its file name. */
public record LocalDocument(String fileName, Path path) {

  @NotNull
  @Override
  public String toString() {
    return fileName;
  }
}
