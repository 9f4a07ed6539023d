package eventmanager;

import eventmanager.hash.Murmur3;

import java.util.Objects;

/**
 * Canonical 32-bit unsigned key identifying a category of event.
 *
 * <p>Normally obtained by hashing a type name with {@link #of(String)}, which applies
 * {@link Murmur3} with the fixed {@link #SEED} to the UTF-8 bytes of the name. The same name
 * yields the same identifier in every run and in every process using this seed. Raw values
 * can be wrapped with {@link #fromValue(int)} or {@link #fromUnsigned(long)}.
 *
 * <p>The value is held in an {@code int}; {@link #unsignedValue()} exposes it as the
 * unsigned quantity.
 */
public final class EventTypeId {

  /** Seed used for every name-to-identifier conversion. */
  public static final int SEED = 0;

  private static final long UNSIGNED_MAX = 0xFFFF_FFFFL;

  private final int value;

  private EventTypeId(int value) {
    this.value = value;
  }

  /**
   * Hashes an event type name into its identifier.
   *
   * <p>Any string is accepted; the empty name hashes to {@code 0x00000000}.
   *
   * @param name the event type name
   * @return the identifier
   * @throws NullPointerException if name is null
   */
  public static EventTypeId of(String name) {
    Objects.requireNonNull(name, "name");
    return new EventTypeId(Murmur3.hash32(name, SEED));
  }

  /**
   * Returns the identifier of a type-safe event type.
   *
   * @param eventType the event type
   * @return the identifier derived from {@link EventType#name()}
   */
  public static EventTypeId of(EventType eventType) {
    Objects.requireNonNull(eventType, "eventType");
    return of(eventType.name());
  }

  /**
   * Wraps a raw identifier. The bits are interpreted as an unsigned 32-bit value.
   *
   * @param value the raw bits
   * @return the identifier
   */
  public static EventTypeId fromValue(int value) {
    return new EventTypeId(value);
  }

  /**
   * Wraps a raw unsigned identifier.
   *
   * @param value a value in {@code [0, 2^32 - 1]}
   * @return the identifier
   * @throws IllegalArgumentException if value is out of range
   */
  public static EventTypeId fromUnsigned(long value) {
    if (value < 0 || value > UNSIGNED_MAX) {
      throw new IllegalArgumentException("Event type id out of unsigned 32-bit range: " + value);
    }
    return new EventTypeId((int) value);
  }

  /** Raw 32 bits of the identifier. */
  public int value() {
    return value;
  }

  public long unsignedValue() {
    return Integer.toUnsignedLong(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventTypeId)) return false;
    return value == ((EventTypeId) o).value;
  }

  @Override
  public int hashCode() {
    return value;
  }

  @Override
  public String toString() {
    return String.format("0x%08x", value);
  }
}
