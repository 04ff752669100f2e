package relay.spi;

import java.util.Objects;

/**
 * Outcome of a single {@link Sink#insert} call.
 *
 * <p>Use {@link #ok()} for success and {@link #failed(SinkError, String)} otherwise.
 *
 * @param error   failure classification, {@code null} on success
 * @param message optional human-readable detail, {@code null} on success
 */
public record SinkResult(SinkError error, String message) {

  private static final SinkResult OK = new SinkResult(null, null);

  public static SinkResult ok() {
    return OK;
  }

  public static SinkResult failed(SinkError error, String message) {
    return new SinkResult(Objects.requireNonNull(error, "error"), message);
  }

  public static SinkResult rateLimited(String message) {
    return failed(SinkError.RATE_LIMITED, message);
  }

  public static SinkResult transientFailure(String message) {
    return failed(SinkError.TRANSIENT, message);
  }

  public static SinkResult permanentFailure(String message) {
    return failed(SinkError.PERMANENT, message);
  }

  public boolean isOk() {
    return error == null;
  }
}
