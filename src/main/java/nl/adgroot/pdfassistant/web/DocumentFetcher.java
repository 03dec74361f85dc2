package nl.adgroot.pdfassistant.web;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import nl.adgroot.pdfassistant.pdf.DocumentStore;
import nl.adgroot.pdfassistant.pdf.LocalDocument;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Downloads PDF references into the {@link DocumentStore}.
 *
 * <p>The store is a cache keyed by file name only (the last path segment of the URL): a
 * file that is already present is never downloaded again, even when the remote content
 * changed, and two URLs ending in the same file name share one local document.
 */
public class DocumentFetcher {

  private final OkHttpClient http;
  private final DocumentStore store;

  public DocumentFetcher(OkHttpClient http, DocumentStore store) {
    this.http = http;
    this.store = store;
  }

  /** Same as {@link #fetch(List, Consumer)}, reporting skipped references on stderr. */
  public List<LocalDocument> fetch(List<String> pdfUrls) {
    return fetch(pdfUrls, e -> {
      synchronized (System.err) {
        System.err.println("Failed to download " + e.getUrl() + ": " + e.getMessage());
      }
    });
  }

  /**
   * Fetches every reference in order. A reference that cannot be downloaded is handed to
   * {@code onFailure} and left out of the result; the remaining references are still
   * processed.
   *
   * @return one document per distinct file name, in first-seen order
   */
  public List<LocalDocument> fetch(List<String> pdfUrls, Consumer<DownloadException> onFailure) {
    List<LocalDocument> documents = new ArrayList<>();
    Set<String> seen = new HashSet<>();

    for (String pdfUrl : pdfUrls) {
      try {
        String fileName = fileNameOf(pdfUrl);
        if (seen.contains(fileName)) {
          continue;
        }

        LocalDocument doc;
        if (store.contains(fileName)) {
          doc = store.document(fileName);
          System.out.println("Already present, skipping download: " + fileName);
        } else {
          doc = download(pdfUrl, fileName);
          System.out.println("Downloaded: " + fileName);
        }

        seen.add(fileName);
        documents.add(doc);
      } catch (DownloadException e) {
        onFailure.accept(e);
      }
    }
    return documents;
  }

  /**
   * Local file name for a PDF URL: its last path segment, percent-decoded.
   *
   * @throws DownloadException if the segment is empty, a path separator or dot name, or
   *     holds characters the filesystem rejects (such as a decoded {@code %00})
   */
  public static String fileNameOf(String pdfUrl) throws DownloadException {
    HttpUrl url = pdfUrl == null ? null : HttpUrl.parse(pdfUrl);
    if (url == null) {
      throw new DownloadException(pdfUrl, "Not an http(s) URL");
    }

    List<String> segments = url.pathSegments();
    String last = segments.get(segments.size() - 1);
    if (last.isBlank() || last.equals(".") || last.equals("..")
        || last.contains("/") || last.contains("\\")) {
      throw new DownloadException(pdfUrl, "Cannot derive a file name from URL path " + url.encodedPath());
    }
    try {
      Path.of(last);
    } catch (InvalidPathException e) {
      throw new DownloadException(pdfUrl, "Not a valid local file name: " + e.getReason(), e);
    }
    return last;
  }

  private LocalDocument download(String pdfUrl, String fileName) throws DownloadException {
    Request request = new Request.Builder().url(pdfUrl).get().build();

    Path tmp = null;
    try (Response r = http.newCall(request).execute()) {
      if (!r.isSuccessful()) {
        throw new DownloadException(pdfUrl, "HTTP " + r.code() + " " + r.message());
      }
      ResponseBody body = r.body();
      if (body == null) {
        throw new DownloadException(pdfUrl, "Empty response body");
      }

      tmp = store.newTempFile();
      try (InputStream in = body.byteStream()) {
        Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
      }
      Path published = store.publish(tmp, fileName);
      tmp = null;
      return new LocalDocument(fileName, published);
    } catch (IOException e) {
      throw new DownloadException(pdfUrl, e.getMessage() == null ? e.toString() : e.getMessage(), e);
    } finally {
      deleteQuietly(tmp);
    }
  }

  private static void deleteQuietly(Path tmp) {
    if (tmp == null) return;
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      System.err.println("Could not remove partial download " + tmp + ": " + e.getMessage());
    }
  }
}
