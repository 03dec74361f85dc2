package nl.adgroot.pdfassistant.conversation;

import java.util.Locale;
import java.util.Set;
import nl.adgroot.pdfassistant.session.IngestionSession;

/**
 * Ask/answer cycle shared by the front ends: take a question, answer it against the
 * session, hand the answer to the speaker, repeat until the token is cancelled.
 */
public class ConversationLoop {

  public static final Set<String> STOP_WORDS = Set.of("exit", "quit", "stop");
  public static final String NOT_UNDERSTOOD = "Sorry, I did not understand that.";

  private final IngestionSession session;
  private final QuestionSource questions;
  private final Speaker speaker;

  public ConversationLoop(IngestionSession session, QuestionSource questions, Speaker speaker) {
    this.session = session;
    this.questions = questions;
    this.speaker = speaker;
  }

  /** @return number of questions that were answered (including not-ready replies) */
  public int run(CancellationToken token) {
    int answered = 0;

    while (!token.isCancelled()) {
      String question = questions.nextQuestion();

      if (question == null || question.isBlank()) {
        speaker.speak(NOT_UNDERSTOOD);
        continue;
      }
      if (STOP_WORDS.contains(question.trim().toLowerCase(Locale.ROOT))) {
        token.cancel();
        break;
      }

      speaker.speak(session.ask(question.trim()));
      answered++;
    }
    return answered;
  }
}
