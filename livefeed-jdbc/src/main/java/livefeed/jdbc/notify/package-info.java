/**
 * PostgreSQL {@code LISTEN}/{@code NOTIFY} notification feed.
 */
package livefeed.jdbc.notify;
