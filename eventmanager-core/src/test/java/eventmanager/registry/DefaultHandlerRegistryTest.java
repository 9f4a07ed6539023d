package eventmanager.registry;

import eventmanager.EventHandler;
import eventmanager.EventTypeId;
import eventmanager.Handler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefaultHandlerRegistryTest {

  private static final EventTypeId TYPE = EventTypeId.of("PlayerJoined");
  private static final EventHandler NOOP = event -> {};

  @Test
  void returnsEmptyListForUnregisteredEventType() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertTrue(registry.handlersFor(EventTypeId.of("Unknown")).isEmpty());
    assertFalse(registry.hasHandlers(EventTypeId.of("Unknown")));
  }

  @Test
  void returnsHandlersInPriorityOrder() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    Handler low = Handler.of(1, NOOP);
    Handler mid = Handler.of(5, NOOP);
    Handler high = Handler.of(10, NOOP);

    registry.add(TYPE, mid);
    registry.add(TYPE, high);
    registry.add(TYPE, low);

    assertEquals(List.of(high, mid, low), registry.handlersFor(TYPE));
  }

  @Test
  void duplicateIsNotAddedTwice() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertTrue(registry.add(TYPE, Handler.of(3, "audit", NOOP)));
    assertFalse(registry.add(TYPE, Handler.of(3, "audit", event -> {})));

    assertEquals(1, registry.handlersFor(TYPE).size());
  }

  @Test
  void removeRequiresPriorityAndKeyMatch() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    Handler audit = Handler.of(3, "audit", NOOP);
    registry.add(TYPE, audit);

    assertFalse(registry.remove(TYPE, Handler.of(3, "other", NOOP)));
    assertFalse(registry.remove(TYPE, Handler.of(4, "audit", NOOP)));
    assertTrue(registry.remove(TYPE, Handler.of(3, "audit", NOOP)));
    assertTrue(registry.handlersFor(TYPE).isEmpty());
  }

  @Test
  void removeFromUnknownTypeIsNoOp() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertFalse(registry.remove(EventTypeId.of("Unknown"), Handler.of(1, NOOP)));
    assertEquals(0, registry.typeCount());
  }

  @Test
  void emptiedTypeIsDropped() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    Handler handler = Handler.of(1, NOOP);
    registry.add(TYPE, handler);
    assertEquals(1, registry.typeCount());

    registry.remove(TYPE, handler);

    assertEquals(0, registry.typeCount());
    assertFalse(registry.hasHandlers(TYPE));
  }

  @Test
  void snapshotIsUnaffectedByLaterChanges() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    Handler first = Handler.of(1, NOOP);
    registry.add(TYPE, first);

    List<Handler> snapshot = registry.handlersFor(TYPE);
    registry.add(TYPE, Handler.of(2, NOOP));
    registry.remove(TYPE, first);

    assertEquals(List.of(first), snapshot);
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(Handler.of(0, NOOP)));
  }

  @Test
  void typesAreIndependent() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    registry.add(TYPE, Handler.of(1, NOOP));
    registry.add(EventTypeId.of("PlayerLeft"), Handler.of(1, NOOP));
    registry.add(EventTypeId.of("PlayerLeft"), Handler.of(2, NOOP));

    assertEquals(1, registry.handlersFor(TYPE).size());
    assertEquals(2, registry.handlersFor(EventTypeId.of("PlayerLeft")).size());
    assertEquals(2, registry.typeCount());
  }

  @Test
  void rejectsNulls() {
    DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

    assertThrows(NullPointerException.class, () -> registry.add(null, Handler.of(1, NOOP)));
    assertThrows(NullPointerException.class, () -> registry.add(TYPE, null));
    assertThrows(NullPointerException.class, () -> registry.remove(TYPE, null));
  }
}
