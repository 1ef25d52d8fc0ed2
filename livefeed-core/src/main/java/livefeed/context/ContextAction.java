package livefeed.context;

/**
 * Unit of work run inside a transaction context.
 *
 * <p>The checked exception type {@code E} propagates unchanged through
 * {@link Contexts#withAuthorized} and {@link Contexts#withUnauthorized}.
 *
 * @param <C> context type handed to the action
 * @param <T> result type
 * @param <E> checked exception type the action may throw
 */
@FunctionalInterface
public interface ContextAction<C, T, E extends Exception> {
  T run(C context) throws E;
}
