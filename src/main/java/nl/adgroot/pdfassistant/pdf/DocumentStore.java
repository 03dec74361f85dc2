package nl.adgroot.pdfassistant.pdf;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * The working directory holding downloaded and merged PDFs by file name.
 *
 * <p>Files are only ever published through {@link #publish(Path, String)}: content is
 * written to a temp file in the same directory first and then moved into place, so
 * {@link #contains(String)} never sees a half-written document.
 */
public class DocumentStore {

  private static final String TEMP_PREFIX = ".part-";

  private final Path directory;

  public DocumentStore(Path directory) throws IOException {
    this.directory = directory.toAbsolutePath().normalize();
    Files.createDirectories(this.directory);
  }

  public Path getDirectory() {
    return directory;
  }

  public Path resolve(String fileName) {
    Path p = directory.resolve(fileName).normalize();
    if (!directory.equals(p.getParent())) {
      throw new IllegalArgumentException("Not a plain file name: " + fileName);
    }
    return p;
  }

  public boolean contains(String fileName) {
    return Files.isRegularFile(resolve(fileName));
  }

  public LocalDocument document(String fileName) {
    return new LocalDocument(fileName, resolve(fileName));
  }

  /** Creates an empty temp file inside the store; pass it to {@link #publish} when complete. */
  public Path newTempFile() throws IOException {
    return Files.createTempFile(directory, TEMP_PREFIX, ".tmp");
  }

  public LocalDocument write(String fileName, byte[] content) throws IOException {
    Path tmp = newTempFile();
    try {
      Files.write(tmp, content);
      return new LocalDocument(fileName, publish(tmp, fileName));
    } catch (IOException e) {
      Files.deleteIfExists(tmp);
      throw e;
    }
  }

  /** Moves a completed temp file over {@code fileName}, replacing any existing file. */
  public Path publish(Path tempFile, String fileName) throws IOException {
    Path target = resolve(fileName);
    try {
      Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
    }
    return target;
  }

  public boolean delete(String fileName) throws IOException {
    return Files.deleteIfExists(resolve(fileName));
  }

  /** File names of all published documents, sorted. Temp files are not listed. */
  public List<String> list() throws IOException {
    List<String> names = new ArrayList<>();
    try (Stream<Path> files = Files.list(directory)) {
      files.filter(Files::isRegularFile)
          .map(p -> p.getFileName().toString())
          .filter(n -> !n.startsWith(TEMP_PREFIX))
          .sorted()
          .forEach(names::add);
    }
    return names;
  }
}
