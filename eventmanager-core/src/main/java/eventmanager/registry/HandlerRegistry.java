package eventmanager.registry;

import eventmanager.EventTypeId;
import eventmanager.Handler;

import java.util.List;

/**
 * Registry mapping event type identifiers to ordered handler sets.
 *
 * <p>The dispatcher uses this registry to find the handlers that process a given event.
 * Handlers are returned in {@link Handler#ORDER} and executed sequentially.
 *
 * @see Handler
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Adds a handler to the set of the given type, creating the set if absent.
   *
   * @param type    the event type identifier
   * @param handler the handler
   * @return {@code true} if added, {@code false} if an equal handler was already present
   */
  boolean add(EventTypeId type, Handler handler);

  /**
   * Removes the handler equal to {@code handler} from the set of the given type.
   *
   * @param type    the event type identifier
   * @param handler the handler to remove
   * @return {@code true} if a handler was removed
   */
  boolean remove(EventTypeId type, Handler handler);

  /**
   * Returns a snapshot of the handlers registered for the given type.
   *
   * <p>Later registrations and removals do not affect a returned snapshot.
   *
   * @param type the event type identifier
   * @return immutable list of handlers in invocation order, may be empty
   */
  List<Handler> handlersFor(EventTypeId type);

  /**
   * Returns {@code true} if at least one handler is registered for the given type.
   *
   * @param type the event type identifier
   * @return whether the type has handlers
   */
  default boolean hasHandlers(EventTypeId type) {
    return !handlersFor(type).isEmpty();
  }
}
