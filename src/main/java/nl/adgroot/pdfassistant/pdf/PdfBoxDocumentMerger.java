package nl.adgroot.pdfassistant.pdf;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.multipdf.PDFMergerUtility;
import org.apache.pdfbox.pdmodel.PDDocument;

/**
 * Merges downloaded PDFs into one document.
 *
 * <p>The output is written into {@code outputStore}. Give it a store other than the
 * download cache, otherwise a later download with the same file name would be served
 * the previous merge result.
 */
public class PdfBoxDocumentMerger {

  private final DocumentStore store;

  public PdfBoxDocumentMerger(DocumentStore outputStore) {
    this.store = outputStore;
  }

  /**
   * Appends the pages of all readable inputs, in input order, into {@code outputName}
   * (overwriting it) and then removes every input from the store.
   *
   * <p>An input that cannot be opened, has no pages or cannot be appended is skipped, and
   * none of its pages end up in the output. If no input contributes a page, nothing is
   * written and the inputs stay where they are.
   *
   * @throws MergeException if there are no inputs, none of them is readable, or the
   *     merged document cannot be saved
   */
  public MergedDocument merge(List<LocalDocument> docs, String outputName) throws MergeException {
    if (docs == null || docs.isEmpty()) {
      throw new MergeException("Nothing to merge: no input documents");
    }

    Path output = store.resolve(outputName);
    PDFMergerUtility merger = new PDFMergerUtility();

    // sources must stay open until the destination has been saved
    List<PDDocument> opened = new ArrayList<>();
    int merged = 0;
    int pageCount;

    try (PDDocument destination = new PDDocument()) {
      for (LocalDocument doc : docs) {
        try {
          PDDocument source = Loader.loadPDF(doc.path().toFile());
          opened.add(source);

          if (source.getNumberOfPages() == 0) {
            System.err.println("Skipping " + doc.fileName() + ": document has no pages");
            continue;
          }

          // a failing append may leave part of the source behind, so it goes to scratch first
          PDDocument scratch = new PDDocument();
          opened.add(scratch);
          appendPages(merger, scratch, source);
          merger.appendDocument(destination, scratch);
          merged++;
        } catch (IOException | RuntimeException e) {
          System.err.println("Error merging " + doc.fileName() + ": " + e);
        }
      }

      if (merged == 0) {
        throw new MergeException("None of the " + docs.size() + " input documents could be merged");
      }

      pageCount = destination.getNumberOfPages();
      save(destination, outputName);
    } catch (IOException e) {
      throw new MergeException("Could not write merged document " + output + ": " + e.getMessage(), e);
    } finally {
      closeAll(opened);
    }

    System.out.println("Merged PDF saved at: " + output + " (" + merged + "/" + docs.size()
        + " documents, " + pageCount + " pages)");

    deleteInputs(docs, output);
    return new MergedDocument(output, pageCount);
  }

  /** Appends every page of {@code source} to {@code target}. */
  protected void appendPages(PDFMergerUtility merger, PDDocument target, PDDocument source) throws IOException {
    merger.appendDocument(target, source);
  }

  private void save(PDDocument destination, String outputName) throws IOException {
    Path tmp = store.newTempFile();
    try {
      destination.save(tmp.toFile());
      store.publish(tmp, outputName);
    } catch (IOException e) {
      Files.deleteIfExists(tmp);
      throw e;
    }
  }

  private static void deleteInputs(List<LocalDocument> docs, Path output) {
    for (LocalDocument doc : docs) {
      if (doc.path().toAbsolutePath().normalize().equals(output)) continue;
      try {
        if (Files.deleteIfExists(doc.path())) {
          System.out.println("Deleted " + doc.fileName() + " after merging.");
        }
      } catch (IOException e) {
        System.err.println("Error deleting " + doc.fileName() + ": " + e.getMessage());
      }
    }
  }

  private static void closeAll(List<PDDocument> docs) {
    for (PDDocument d : docs) {
      try {
        d.close();
      } catch (IOException e) {
        System.err.println("Error closing merge input: " + e.getMessage());
      }
    }
  }
}
