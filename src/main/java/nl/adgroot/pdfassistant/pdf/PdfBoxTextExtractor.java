package nl.adgroot.pdfassistant.pdf;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;

public class PdfBoxTextExtractor {

  public String extract(MergedDocument doc) throws ExtractionException {
    return extract(doc.path());
  }

  /**
   * Returns the text of all pages in page order, trimmed. A document whose pages carry no
   * text (scanned images only) yields an empty string.
   *
   * @throws ExtractionException if the file cannot be opened or decoded, is
   *     password protected, or has no pages
   */
  public String extract(Path pdfPath) throws ExtractionException {
    try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
      if (document.getNumberOfPages() == 0) {
        throw new ExtractionException("Document has no pages: " + pdfPath.getFileName());
      }

      PDFTextStripper stripper = new PDFTextStripper();
      String text = stripper.getText(document);

      if (text == null) return "";
      return text.replace("\u0000", "").trim();
    } catch (InvalidPasswordException e) {
      throw new ExtractionException("Document is encrypted: " + pdfPath.getFileName(), e);
    } catch (IOException e) {
      throw new ExtractionException("Error reading PDF " + pdfPath.getFileName() + ": " + e.getMessage(), e);
    }
  }
}
