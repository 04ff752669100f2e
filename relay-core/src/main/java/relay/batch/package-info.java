/**
 * Flush orchestration: chunking, de-duplication, delivery and dead-letter re-send.
 *
 * @see relay.batch.BatchProcessor
 */
package relay.batch;
