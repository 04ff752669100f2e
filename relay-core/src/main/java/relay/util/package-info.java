/**
 * Internal helpers.
 */
package relay.util;
