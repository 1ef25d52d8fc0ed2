/**
 * JDBC implementation of the store side: transaction contexts, error translation,
 * dialects and the PostgreSQL notification feed.
 */
package livefeed.jdbc;
