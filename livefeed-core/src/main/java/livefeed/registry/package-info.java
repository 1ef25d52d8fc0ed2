/**
 * The notification channel registry and the in-memory feed.
 */
package livefeed.registry;
