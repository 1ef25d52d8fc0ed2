/**
 * Transaction contexts. {@link livefeed.context.Contexts} is implemented by the jdbc module.
 */
package livefeed.context;
