/**
 * Bounded dead-letter queue for records that exhausted their retries.
 *
 * <p>{@link relay.dead.DeadLetterQueue} is owned by the batch processor and drained
 * opportunistically on the next healthy flush.
 *
 * @see relay.dead.DeadLetterQueue
 * @see relay.batch.BatchProcessor
 */
package relay.dead;
