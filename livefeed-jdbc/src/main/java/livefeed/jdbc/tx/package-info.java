/**
 * JDBC transaction contexts.
 */
package livefeed.jdbc.tx;
