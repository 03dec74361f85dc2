package nl.adgroot.pdfassistant.prompts;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A text template with {@code {{name}}} placeholders.
 *
 * <p>Substitution is a single pass over the template, so placeholder-like text inside a
 * substituted value (for example in extracted PDF text) is left untouched. Placeholders
 * without a value are kept verbatim.
 */
public final class PromptTemplate {

  public static final String QUESTION_ANSWERING = "Context: {{context}}\n\nQuestion: {{question}}";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Za-z0-9_]+)}}");

  private final String template;

  public PromptTemplate(String template) {
    this.template = Objects.requireNonNull(template, "template");
  }

  public static PromptTemplate questionAnswering() {
    return new PromptTemplate(QUESTION_ANSWERING);
  }

  public static PromptTemplate load(Path path) throws IOException {
    return new PromptTemplate(stripFinalNewline(Files.readString(path, StandardCharsets.UTF_8)));
  }

  public static PromptTemplate loadResource(String resourceName) throws IOException {
    try (InputStream in = PromptTemplate.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (in == null) {
        throw new IOException("Prompt template not found on classpath: " + resourceName);
      }
      return new PromptTemplate(stripFinalNewline(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
    }
  }

  public String render(Map<String, String> values) {
    Matcher m = PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder(template.length() + 256);
    while (m.find()) {
      String value = values.get(m.group(1));
      m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  public String getTemplate() {
    return template;
  }

  // editors like to add one; the prompt must end right after the question
  private static String stripFinalNewline(String s) {
    if (s.endsWith("\r\n")) return s.substring(0, s.length() - 2);
    if (s.endsWith("\n")) return s.substring(0, s.length() - 1);
    return s;
  }
}
