/**
 * Bounded-retry delivery of a single batch.
 *
 * <p>{@link relay.dispatch.RetryExecutor} calls the sink up to {@code maxRetries} times,
 * waiting a fixed cool-down after rate-limited attempts and a {@link relay.dispatch.RetryPolicy}
 * delay after any other failure.
 *
 * @see relay.dispatch.RetryExecutor
 * @see relay.dispatch.RetryPolicy
 * @see relay.dispatch.Sleeper
 */
package relay.dispatch;
