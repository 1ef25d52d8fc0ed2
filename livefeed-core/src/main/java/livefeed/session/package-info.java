/**
 * Per-connection subscription sessions, the path router and the wire codec.
 */
package livefeed.session;
