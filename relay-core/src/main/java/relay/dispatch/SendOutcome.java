package relay.dispatch;

import relay.spi.SinkError;

/**
 * Result of sending one chunk through the {@link RetryExecutor}.
 *
 * @param success   whether any attempt was accepted by the sink
 * @param attempts  number of sink calls made
 * @param lastError classification of the last failure, {@code null} on success
 * @param message   detail of the last failure, {@code null} on success
 */
public record SendOutcome(boolean success, int attempts, SinkError lastError, String message) {

  static SendOutcome success(int attempts) {
    return new SendOutcome(true, attempts, null, null);
  }

  static SendOutcome failure(int attempts, SinkError lastError, String message) {
    return new SendOutcome(false, attempts, lastError, message);
  }
}
