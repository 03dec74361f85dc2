package nl.adgroot.pdfassistant.conversation;

/** Input capability of a front end: typed text, a form field or recognized speech. */
@FunctionalInterface
public interface QuestionSource {

  /**
   * Blocks until the user asked something.
   *
   * @return the question, or {@code null} when nothing usable was heard
   */
  String nextQuestion();
}
