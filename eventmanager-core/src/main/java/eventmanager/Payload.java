package eventmanager;

/**
 * Arbitrary data attached to an {@link Event}.
 *
 * <p>A payload is owned by exactly one event. The event closes it once the event is no
 * longer needed: after every matching handler has run, or when a pending event is
 * discarded. Implementations holding resources release them in {@link #close()}.
 *
 * <p>Payloads must not assume that a particular handler runs, that it runs exactly once,
 * or that it runs before another handler.
 */
public interface Payload extends AutoCloseable {

  /**
   * Renders this payload as text for diagnostics.
   *
   * @return a human-readable representation, never null
   */
  String render();

  /**
   * Releases resources held by this payload. Called at most once by the owning event.
   */
  @Override
  default void close() {
  }
}
