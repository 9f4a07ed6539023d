package eventmanager;

/**
 * Represents a named event type.
 *
 * <p>Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum PlayerEvents implements EventType {
 *   PLAYER_JOINED,
 *   PLAYER_LEFT;
 *   // Enum.name() already satisfies the contract
 * }
 * }</pre>
 *
 * <p>Or use {@link StringEventType} for dynamic event types:
 * <pre>{@code
 * EventType type = StringEventType.of("PlayerJoined");
 * }</pre>
 *
 * <p>The name is hashed into an {@link EventTypeId} for routing.
 */
public interface EventType {

  /**
   * Returns the name of this event type, hashed to obtain its {@link EventTypeId}.
   *
   * @return the event type name, never null
   */
  default String name() {
    return this.getClass().getName();
  }

  /**
   * Returns the routing identifier for this event type.
   *
   * @return the identifier derived from {@link #name()}
   */
  default EventTypeId id() {
    return EventTypeId.of(name());
  }
}
