package nl.adgroot.pdfassistant.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public SourceConfig source = new SourceConfig();
  public StoreConfig store = new StoreConfig();
  public HttpConfig http = new HttpConfig();
  public LlmConfig llm = new LlmConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SourceConfig {
    // page scanned for PDF links when no URL is given on the command line
    public String baseUrl = "https://www.bvuniversity.edu.in/coepune/";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class StoreConfig {
    public String directory = "pdfs";
    // merged output lives in this subdirectory of the download directory, out of the download cache
    public String outputDirectory = "merged";
    public String mergedFileName = "merged.pdf";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class HttpConfig {
    public int connectTimeoutSeconds = 10;
    public int readTimeoutSeconds = 60;
    public int writeTimeoutSeconds = 60;
    public int callTimeoutSeconds = 120;
    public String userAgent = "pdf-question-assistant/1.0";
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class LlmConfig {
    // "gemini" or "ollama"
    public String provider = "gemini";
    public String model = "gemini-1.5-flash";

    // name of the environment variable holding the key; apiKey is only a fallback
    public String apiKeyEnv = "API";
    public String apiKey = null;

    public String baseUrl = "https://generativelanguage.googleapis.com";
    public double temperature = 0.3;
    public int timeoutSeconds = 120;

    // only used by the ollama provider
    public String host = "127.0.0.1";
    public int port = 11434;
    public String generatePath = "/api/generate";
  }
}
