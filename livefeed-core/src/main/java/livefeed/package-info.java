/**
 * Core model of the real-time subscription layer: account identity, typed channels,
 * parameterized queries and the client-visible error taxonomy.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code livefeed.context} - transactional query contexts and the subscription context</li>
 *   <li>{@code livefeed.registry} - the reference-counted notification channel registry</li>
 *   <li>{@code livefeed.session} - the per-connection subscription session and wire codec</li>
 *   <li>{@code livefeed.liveness} - ping/pong liveness monitoring</li>
 *   <li>{@code livefeed.spi} - extension points implemented by the jdbc, netty and micrometer modules</li>
 * </ul>
 */
package livefeed;
