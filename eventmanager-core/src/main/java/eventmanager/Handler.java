package eventmanager;

import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A registered callback together with its invocation priority and identity key.
 *
 * <p>Within one event type, handlers are invoked in {@link #ORDER}: higher {@link #priority()}
 * first, then ascending {@link #key()}. Two handlers with the same priority and key are the
 * same member of a handler set, whatever their callbacks; registering the second one is a
 * no-op, and either one removes the other.
 *
 * <p>Handlers built with {@link #of(int, EventHandler)} receive a generated key from a
 * process-wide sequence, so they never collide with each other and equal-priority anonymous
 * handlers run in the order they were created. Use {@link #of(int, String, EventHandler)}
 * to assign a stable key that can be reproduced when removing the handler.
 *
 * <pre>{@code
 * Handler audit = Handler.of(100, "audit", event -> audit.log(event));
 * dispatcher.addHandler("PlayerJoined", audit);
 * ...
 * dispatcher.removeHandler("PlayerJoined", audit);
 * }</pre>
 */
public final class Handler {

  /** Higher priority first, then ascending key. */
  public static final Comparator<Handler> ORDER =
      Comparator.comparingInt(Handler::priority).reversed()
          .thenComparing(Handler::key);

  private static final String GENERATED_KEY_PREFIX = "handler-";
  private static final AtomicLong SEQUENCE = new AtomicLong();

  private final int priority;
  private final String key;
  private final EventHandler callback;

  private Handler(int priority, String key, EventHandler callback) {
    this.priority = priority;
    this.key = Objects.requireNonNull(key, "key");
    if (key.isEmpty()) {
      throw new IllegalArgumentException("Handler key cannot be empty");
    }
    this.callback = Objects.requireNonNull(callback, "callback");
  }

  /**
   * Creates a handler with a generated identity key.
   *
   * @param priority invocation priority; higher runs first
   * @param callback the callback
   * @return a new handler
   */
  public static Handler of(int priority, EventHandler callback) {
    return new Handler(priority, nextKey(), callback);
  }

  /**
   * Creates a handler with an explicit identity key.
   *
   * @param priority invocation priority; higher runs first
   * @param key      identity key breaking ties between equal priorities
   * @param callback the callback
   * @return a new handler
   * @throws IllegalArgumentException if key is empty
   */
  public static Handler of(int priority, String key, EventHandler callback) {
    return new Handler(priority, key, callback);
  }

  private static String nextKey() {
    return GENERATED_KEY_PREFIX + String.format("%019d", SEQUENCE.incrementAndGet());
  }

  public int priority() {
    return priority;
  }

  public String key() {
    return key;
  }

  public EventHandler callback() {
    return callback;
  }

  /**
   * Equality follows {@link #ORDER}: same priority and same key.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Handler)) return false;
    Handler that = (Handler) o;
    return priority == that.priority && key.equals(that.key);
  }

  @Override
  public int hashCode() {
    return 31 * priority + key.hashCode();
  }

  @Override
  public String toString() {
    return "Handler{priority=" + priority + ", key=" + key + '}';
  }
}
