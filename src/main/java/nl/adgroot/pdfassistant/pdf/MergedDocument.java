package nl.adgroot.pdfassistant.pdf;

import java.nio.file.Path;
import org.jetbrains.annotations.NotNull;

public record MergedDocument(Path path, int pageCount) {

  @NotNull
  @Override
  public String toString() {
    return path.getFileName() + " (" + pageCount + " pages)";
  }
}
