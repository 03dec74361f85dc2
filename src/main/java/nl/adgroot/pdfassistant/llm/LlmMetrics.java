package nl.adgroot.pdfassistant.llm;

public record LlmMetrics(
    long totalDurationNs,
    int promptTokenCount,
    int responseTokenCount
) {
  public static final LlmMetrics NONE = new LlmMetrics(0, 0, 0);

  public long totalMillis() {
    return totalDurationNs / 1_000_000;
  }

  public double responseTokensPerSecond() {
    return totalDurationNs == 0 ? 0 :
        (responseTokenCount / (totalDurationNs / 1_000_000_000.0));
  }
}
