package nl.adgroot.pdfassistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {

  public static final String DEFAULT_FILE_NAME = "config.json";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path configPath) throws IOException {
    try (InputStream in = Files.newInputStream(configPath)) {
      return MAPPER.readValue(in, AppConfig.class);
    }
  }

  /**
   * Loads {@code config.json} from the working directory if present, otherwise from the
   * classpath. Falls back to built-in defaults when neither exists.
   */
  public static AppConfig loadDefault() throws IOException {
    Path local = Path.of(DEFAULT_FILE_NAME);
    if (Files.isRegularFile(local)) {
      return load(local);
    }
    try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_FILE_NAME)) {
      if (in == null) {
        return new AppConfig();
      }
      return MAPPER.readValue(in, AppConfig.class);
    }
  }

  /**
   * Resolves the language-model credential: the environment variable named by
   * {@code llm.apiKeyEnv} wins, {@code llm.apiKey} from the file is the fallback.
   *
   * @return the key, or {@code null} if none is configured
   */
  public static String resolveApiKey(AppConfig.LlmConfig cfg, Map<String, String> env) {
    if (cfg.apiKeyEnv != null && !cfg.apiKeyEnv.isBlank()) {
      String fromEnv = env.get(cfg.apiKeyEnv);
      if (fromEnv != null && !fromEnv.isBlank()) {
        return fromEnv.trim();
      }
    }
    if (cfg.apiKey != null && !cfg.apiKey.isBlank()) {
      return cfg.apiKey.trim();
    }
    return null;
  }
}
