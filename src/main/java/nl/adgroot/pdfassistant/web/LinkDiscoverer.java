package nl.adgroot.pdfassistant.web;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Finds the PDF documents a web page links to.
 *
 * <p>A link qualifies when the path of its resolved URL ends with {@code .pdf}. The check
 * is case-sensitive, so {@code REPORT.PDF} is not picked up. Links are neither followed
 * nor content-sniffed.
 */
public class LinkDiscoverer {

  private static final String PDF_SUFFIX = ".pdf";

  private final OkHttpClient http;

  public LinkDiscoverer(OkHttpClient http) {
    this.http = http;
  }

  /**
   * @return absolute PDF URLs in document order; duplicates are kept
   * @throws FetchException if the page is unreachable or answers with a non-2xx status
   */
  public List<String> discover(String baseUrl) throws FetchException {
    HttpUrl base = baseUrl == null ? null : HttpUrl.parse(baseUrl);
    if (base == null) {
      throw new FetchException("Invalid base URL: " + baseUrl, -1);
    }

    String html = fetchPage(base);
    return extractPdfLinks(html, base.toString());
  }

  /** Selects PDF links from an already fetched page. */
  public List<String> extractPdfLinks(String html, String baseUrl) {
    Document doc = Jsoup.parse(html, baseUrl);

    List<String> pdfUrls = new ArrayList<>();
    for (Element link : doc.select("a[href]")) {
      String absolute = link.absUrl("href");
      if (absolute.isEmpty()) continue;

      HttpUrl url = HttpUrl.parse(absolute);
      if (url == null) continue; // mailto:, javascript:, ...

      if (url.encodedPath().endsWith(PDF_SUFFIX)) {
        pdfUrls.add(url.toString());
      }
    }
    return pdfUrls;
  }

  private String fetchPage(HttpUrl url) throws FetchException {
    Request request = new Request.Builder().url(url).get().build();

    try (Response r = http.newCall(request).execute()) {
      if (!r.isSuccessful()) {
        throw new FetchException("Fetching " + url + " failed: " + r.code() + " " + r.message(), r.code());
      }
      ResponseBody body = r.body();
      return body == null ? "" : body.string();
    } catch (IOException e) {
      throw new FetchException("Fetching " + url + " failed: " + e.getMessage(), e);
    }
  }
}
