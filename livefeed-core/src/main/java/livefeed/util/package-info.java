/**
 * Concurrency helpers shared by the registry, sessions and schedulers.
 */
package livefeed.util;
