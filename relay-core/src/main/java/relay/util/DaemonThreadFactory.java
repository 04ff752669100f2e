package relay.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the relay's background threads.
 *
 * <p>Threads are daemons named {@code <prefix>1}, {@code <prefix>2}, and so on, so the flush
 * timer never holds the host JVM open; the final flush runs from a shutdown hook instead.
 * Anything that escapes a task is logged rather than printed to {@code System.err}.
 */
public final class DaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

  private final String namePrefix;
  private final AtomicInteger sequence = new AtomicInteger();

  public DaemonThreadFactory(String namePrefix) {
    this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread worker = new Thread(task);
    worker.setName(namePrefix + sequence.incrementAndGet());
    worker.setDaemon(true);
    worker.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught failure on relay thread " + t.getName(), e));
    return worker;
  }

  public int threadsCreated() {
    return sequence.get();
  }
}
