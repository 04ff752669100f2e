package relay.lifecycle;

/**
 * Process-termination signals the relay can hook into.
 *
 * <p>{@link JvmShutdownLifecycle} maps hooks onto JVM shutdown hooks. Containers that manage
 * their own shutdown sequence (for example a Spring application context) provide their own
 * implementation so the final flush runs before their resources are torn down.
 */
public interface Lifecycle {

  /**
   * Registers a hook to run once when the process is shutting down.
   *
   * @param name diagnostic name of the hook
   * @param hook action to run, must not throw
   * @return a handle that unregisters the hook
   */
  Registration onShutdown(String name, Runnable hook);

  /** Handle returned by {@link #onShutdown}. */
  interface Registration {

    /** Unregisters the hook. Calling it more than once has no effect. */
    void cancel();
  }
}
