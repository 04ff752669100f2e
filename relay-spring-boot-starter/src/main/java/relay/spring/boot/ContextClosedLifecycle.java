package relay.spring.boot;

import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import relay.lifecycle.Lifecycle;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Lifecycle} driven by the Spring application context.
 *
 * <p>Hooks run when the context publishes {@link ContextClosedEvent}, before singleton
 * beans such as the {@code DataSource} are destroyed. Spring's own JVM shutdown hook closes
 * the context on SIGINT / SIGTERM.
 */
public class ContextClosedLifecycle implements Lifecycle, ApplicationListener<ContextClosedEvent> {
  private static final Logger logger = Logger.getLogger(ContextClosedLifecycle.class.getName());

  private final Map<Object, NamedHook> hooks = new ConcurrentHashMap<>();

  @Override
  public Registration onShutdown(String name, Runnable hook) {
    Object key = new Object();
    hooks.put(key, new NamedHook(name, hook));
    return () -> hooks.remove(key);
  }

  @Override
  public void onApplicationEvent(ContextClosedEvent event) {
    for (NamedHook hook : hooks.values()) {
      try {
        hook.action().run();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Shutdown hook " + hook.name() + " failed", e);
      }
    }
  }

  int hookCount() {
    return hooks.size();
  }

  private record NamedHook(String name, Runnable action) {}
}
