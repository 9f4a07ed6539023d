package eventmanager.registry;

import eventmanager.EventTypeId;
import eventmanager.Handler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Handler registry backed by one {@link TreeSet} per event type.
 *
 * <p>Iteration order inside a set is {@link Handler#ORDER}, independent of insertion order.
 * Handlers comparing equal under that order are deduplicated. Sets emptied by removal are
 * dropped.
 *
 * <h2>Thread Safety</h2>
 * <p>Not thread-safe. All calls are expected on the thread that owns the dispatcher.
 * Snapshots returned by {@link #handlersFor} are immutable and can be iterated while the
 * registry changes.
 *
 * @see HandlerRegistry
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {

  private final Map<EventTypeId, NavigableSet<Handler>> handlers = new HashMap<>();

  @Override
  public boolean add(EventTypeId type, Handler handler) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    return handlers.computeIfAbsent(type, ignored -> new TreeSet<>(Handler.ORDER)).add(handler);
  }

  @Override
  public boolean remove(EventTypeId type, Handler handler) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    NavigableSet<Handler> set = handlers.get(type);
    if (set == null) {
      return false;
    }
    boolean removed = set.remove(handler);
    if (set.isEmpty()) {
      handlers.remove(type);
    }
    return removed;
  }

  @Override
  public List<Handler> handlersFor(EventTypeId type) {
    NavigableSet<Handler> set = handlers.get(type);
    return set == null ? List.of() : List.copyOf(set);
  }

  @Override
  public boolean hasHandlers(EventTypeId type) {
    return handlers.containsKey(type);
  }

  /**
   * Returns the number of event types with at least one handler.
   *
   * @return number of registered event types
   */
  public int typeCount() {
    return handlers.size();
  }
}
