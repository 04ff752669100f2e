package relay.lifecycle;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Lifecycle} backed by {@link Runtime#addShutdownHook}.
 *
 * <p>Hooks run on normal exit and on SIGINT / SIGTERM. The JVM exits once every hook
 * has returned.
 */
public final class JvmShutdownLifecycle implements Lifecycle {
  private static final Logger logger = Logger.getLogger(JvmShutdownLifecycle.class.getName());

  public static final JvmShutdownLifecycle INSTANCE = new JvmShutdownLifecycle();

  private JvmShutdownLifecycle() {}

  @Override
  public Registration onShutdown(String name, Runnable hook) {
    Objects.requireNonNull(hook, "hook");
    Thread thread = new Thread(hook, name);
    Runtime.getRuntime().addShutdownHook(thread);
    return new Registration() {
      private boolean cancelled;

      @Override
      public synchronized void cancel() {
        if (cancelled) {
          return;
        }
        cancelled = true;
        try {
          Runtime.getRuntime().removeShutdownHook(thread);
        } catch (IllegalStateException e) {
          // JVM already shutting down; the hook runs regardless.
          logger.log(Level.FINE, "Shutdown in progress; hook {0} stays registered", name);
        }
      }
    };
  }
}
