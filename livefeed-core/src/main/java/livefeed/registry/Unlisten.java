package livefeed.registry;

/**
 * Removes one listener registration. Calling it more than once has no further effect.
 */
@FunctionalInterface
public interface Unlisten {
  void unlisten();
}
