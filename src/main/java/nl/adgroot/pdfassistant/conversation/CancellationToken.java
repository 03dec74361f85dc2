package nl.adgroot.pdfassistant.conversation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for one conversation. Checked between turns only: a download or
 * model call that is already running finishes first.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
