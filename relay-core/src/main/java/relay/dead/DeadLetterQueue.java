package relay.dead;

import relay.TelemetryRecord;
import relay.circuit.CircuitBreaker;
import relay.circuit.CircuitState;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-memory holding area for records whose batch could not be delivered.
 *
 * <p>When an {@link #enqueue} pushes the size past {@link #capacity()}, the oldest entries
 * are evicted until the size equals the capacity. The number of evictions is returned so
 * the caller can account for the dropped records.
 *
 * <p>The queue never calls the sink. {@link #drainIfHealthy} hands candidates back to the
 * batch processor, which re-sends them and then {@linkplain #acknowledge confirms} the
 * ones that were delivered. Entries are not persisted across restarts.
 *
 * <p>This class is thread-safe.
 */
public final class DeadLetterQueue {
  private static final Logger logger = Logger.getLogger(DeadLetterQueue.class.getName());

  private final int capacity;
  private final Clock clock;
  private final ArrayDeque<DeadLetterEntry> entries = new ArrayDeque<>();
  private long nextId = 1;

  public DeadLetterQueue(int capacity, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    this.capacity = capacity;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends records, evicting the oldest entries if the capacity is exceeded.
   *
   * @param records records to hold
   * @return number of entries evicted by this call
   */
  public synchronized int enqueue(Collection<TelemetryRecord> records) {
    Instant now = clock.instant();
    for (TelemetryRecord record : records) {
      entries.addLast(new DeadLetterEntry(nextId++, record, now));
    }
    int evicted = 0;
    while (entries.size() > capacity) {
      entries.removeFirst();
      evicted++;
    }
    if (evicted > 0) {
      logger.log(Level.WARNING, "Dead-letter queue full (capacity {0}); evicted {1} oldest entries",
          new Object[]{capacity, evicted});
    }
    return evicted;
  }

  /**
   * Returns the current entries, oldest first, when the breaker is {@code CLOSED};
   * an empty list otherwise. The entries stay queued until acknowledged.
   *
   * @param breaker the breaker guarding the sink
   * @return re-send candidates
   */
  public synchronized List<DeadLetterEntry> drainIfHealthy(CircuitBreaker breaker) {
    if (entries.isEmpty() || breaker.state() != CircuitState.CLOSED) {
      return List.of();
    }
    return List.copyOf(entries);
  }

  /**
   * Removes entries that were delivered. Entries already evicted are ignored.
   *
   * @param delivered entries confirmed by the sink
   * @return number of entries removed
   */
  public synchronized int acknowledge(Collection<DeadLetterEntry> delivered) {
    Set<Long> ids = new HashSet<>();
    for (DeadLetterEntry entry : delivered) {
      ids.add(entry.id());
    }
    int before = entries.size();
    entries.removeIf(entry -> ids.contains(entry.id()));
    return before - entries.size();
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized boolean isEmpty() {
    return entries.isEmpty();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Returns a copy of the held entries, oldest first.
   *
   * @return entries currently held
   */
  public synchronized List<DeadLetterEntry> entries() {
    return new ArrayList<>(entries);
  }
}
