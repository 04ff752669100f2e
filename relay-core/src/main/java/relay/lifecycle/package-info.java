/**
 * Periodic and shutdown-time flushing.
 *
 * @see relay.lifecycle.FlushScheduler
 * @see relay.lifecycle.Lifecycle
 */
package relay.lifecycle;
