/**
 * Bounded producer-side buffers drained by each flush.
 */
package relay.buffer;
