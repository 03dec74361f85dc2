package nl.adgroot.pdfassistant;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Worker threads of the console front end. Ingestion runs on its own thread so the
 * interactive side can keep printing while PDFs are downloaded and merged.
 */
public final class AppExecutors implements AutoCloseable {

  private final ExecutorService ingestionWorker;

  private AppExecutors(ExecutorService ingestionWorker) {
    this.ingestionWorker = ingestionWorker;
  }

  public static AppExecutors create() {
    ExecutorService ingestionWorker = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "ingestion");
      t.setDaemon(false);
      return t;
    });

    return new AppExecutors(ingestionWorker);
  }

  public ExecutorService ingestionWorker() {
    return ingestionWorker;
  }

  @Override
  public void close() throws InterruptedException {
    ingestionWorker.shutdown();
    await(ingestionWorker, "ingestionWorker");
  }

  private static void await(ExecutorService es, String name) throws InterruptedException {
    if (!es.awaitTermination(1, TimeUnit.MINUTES)) {
      es.shutdownNow();
      if (!es.awaitTermination(30, TimeUnit.SECONDS)) {
        System.err.println("Executor did not terminate: " + name);
      }
    }
  }
}
