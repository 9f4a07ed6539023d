package eventmanager;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single occurrence of an event type, waiting to be or being dispatched.
 *
 * <p>{@link #priorityLevel()} orders the pending-event queue (higher drains first) and is
 * unrelated to {@link Handler#priority()}. Each event is assigned a ULID-based
 * {@code eventId} by default, used in diagnostics.
 *
 * <p>An event owns its optional {@link Payload}. {@link #close()} releases the payload
 * exactly once; the dispatcher calls it after the event has been dispatched or discarded.
 *
 * <pre>{@code
 * Event event = Event.builder("PlayerJoined")
 *     .priorityLevel(5)
 *     .payload(TextPayload.of("alice"))
 *     .build();
 * }</pre>
 *
 * @see eventmanager.dispatch.EventDispatcher#pushEvent(Event)
 */
public final class Event implements AutoCloseable {

  private final String eventId;
  private final EventTypeId type;
  private final int priorityLevel;
  private final Instant occurredAt;
  private final Payload payload;
  private final AtomicBoolean closed = new AtomicBoolean();

  private Event(Builder builder) {
    this.type = Objects.requireNonNull(builder.type, "type");
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    if (this.eventId.isEmpty()) {
      throw new IllegalArgumentException("eventId cannot be empty");
    }
    this.priorityLevel = builder.priorityLevel;
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
    this.payload = builder.payload;
  }

  /**
   * Creates a builder for an identifier.
   *
   * @param type the event type identifier
   * @return a new builder
   */
  public static Builder builder(EventTypeId type) {
    Objects.requireNonNull(type, "type");
    return new Builder(type);
  }

  /**
   * Creates a builder with a type-safe event type.
   *
   * @param eventType the event type
   * @return a new builder
   */
  public static Builder builder(EventType eventType) {
    return new Builder(EventTypeId.of(eventType));
  }

  /**
   * Creates a builder with a string event type, hashed into an {@link EventTypeId}.
   *
   * @param eventType the event type name
   * @return a new builder
   */
  public static Builder builder(String eventType) {
    return new Builder(EventTypeId.of(eventType));
  }

  /**
   * Creates a payload-less event.
   *
   * @param type          the event type identifier
   * @param priorityLevel the queue priority level
   * @return a new event
   */
  public static Event of(EventTypeId type, int priorityLevel) {
    return builder(type).priorityLevel(priorityLevel).build();
  }

  public static Event of(EventType eventType, int priorityLevel) {
    return builder(eventType).priorityLevel(priorityLevel).build();
  }

  public static Event of(String eventType, int priorityLevel) {
    return builder(eventType).priorityLevel(priorityLevel).build();
  }

  public String eventId() {
    return eventId;
  }

  public EventTypeId type() {
    return type;
  }

  public int priorityLevel() {
    return priorityLevel;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  public Optional<Payload> payload() {
    return Optional.ofNullable(payload);
  }

  /**
   * Returns {@code true} once {@link #close()} has been called.
   *
   * @return whether the payload has been released
   */
  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Releases the payload, if any. Subsequent calls do nothing.
   */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true) && payload != null) {
      payload.close();
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Event{eventId=").append(eventId)
        .append(", type=").append(type)
        .append(", priorityLevel=").append(priorityLevel);
    if (payload != null) {
      sb.append(", payload=").append(payload.render());
    }
    return sb.append('}').toString();
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * Builder for {@link Event}.
   */
  public static final class Builder {
    private final EventTypeId type;
    private String eventId;
    private int priorityLevel;
    private Instant occurredAt;
    private Payload payload;

    private Builder(EventTypeId type) {
      this.type = type;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the queue priority level. Higher levels are drained first.
     *
     * <p>Optional. Defaults to {@code 0}.
     *
     * @param priorityLevel the priority level
     * @return this builder
     */
    public Builder priorityLevel(int priorityLevel) {
      this.priorityLevel = priorityLevel;
      return this;
    }

    /**
     * Sets the event timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param occurredAt the event timestamp
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Attaches a payload. The built event takes ownership of it.
     *
     * <p>Optional. Defaults to no payload.
     *
     * @param payload the payload
     * @return this builder
     */
    public Builder payload(Payload payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Builds the event.
     *
     * @return a new {@link Event}
     * @throws IllegalArgumentException if {@code eventId} was set to an empty string
     */
    public Event build() {
      return new Event(this);
    }
  }
}
