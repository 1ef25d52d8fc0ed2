/**
 * Two-phase ping/pong liveness monitoring of client connections.
 */
package livefeed.liveness;
