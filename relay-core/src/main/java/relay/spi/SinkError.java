package relay.spi;

/**
 * Classification of a failed {@link Sink#insert} call.
 */
public enum SinkError {
  /** The store rejected the call because of an externally imposed rate limit. */
  RATE_LIMITED,
  /** Network blip, timeout, 5xx or any other failure that may succeed on retry. */
  TRANSIENT,
  /** The store rejected the batch itself (schema, auth, malformed payload). */
  PERMANENT
}
