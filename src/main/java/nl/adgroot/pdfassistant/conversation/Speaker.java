package nl.adgroot.pdfassistant.conversation;

/** Output capability of a front end: prints, renders or speaks a reply. */
@FunctionalInterface
public interface Speaker {

  void speak(String text);
}
