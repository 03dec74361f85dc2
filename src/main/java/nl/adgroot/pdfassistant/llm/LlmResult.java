package nl.adgroot.pdfassistant.llm;

public record LlmResult(String response, LlmMetrics metrics) {}
