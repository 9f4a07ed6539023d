package eventmanager.dispatch;

import eventmanager.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Pending-event queue ordered by {@link Event#priorityLevel()}, highest first.
 *
 * <p>Events with equal priority levels leave the queue in the order they entered it.
 * Membership is tracked by identity, so one {@link Event} instance is pending at most once
 * when callers check {@link #contains} before offering. Not thread-safe.
 */
final class EventQueue {

  static final Comparator<QueuedEvent> ORDER =
      Comparator.comparingInt((QueuedEvent q) -> q.event().priorityLevel()).reversed()
          .thenComparingLong(QueuedEvent::sequence);

  private final PriorityQueue<QueuedEvent> queue = new PriorityQueue<>(ORDER);
  private final Set<Event> pending = Collections.newSetFromMap(new IdentityHashMap<>());
  private long nextSequence;

  void offer(Event event) {
    Objects.requireNonNull(event, "event");
    queue.add(new QueuedEvent(event, nextSequence++));
    pending.add(event);
  }

  /** Whether this exact instance is pending. */
  boolean contains(Event event) {
    return pending.contains(event);
  }

  /** Highest-priority pending entry, or {@code null} when empty. Does not remove it. */
  QueuedEvent peek() {
    return queue.peek();
  }

  /**
   * Removes exactly this entry. Entries pushed after it was peeked may now sit at the head,
   * so removal is by entry rather than by position.
   */
  boolean remove(QueuedEvent entry) {
    boolean removed = queue.remove(entry);
    if (removed) {
      pending.remove(entry.event());
    }
    return removed;
  }

  /** Removes all pending events and returns them in drain order. */
  List<Event> clear() {
    return clear(null);
  }

  /**
   * Removes all pending events except {@code retained}, which stays queued, and returns the
   * removed events in drain order.
   *
   * @param retained entry to keep, or {@code null} to remove everything
   */
  List<Event> clear(QueuedEvent retained) {
    List<Event> drained = new ArrayList<>(queue.size());
    boolean keep = false;
    QueuedEvent next;
    while ((next = queue.poll()) != null) {
      if (next == retained) {
        keep = true;
      } else {
        drained.add(next.event());
      }
    }
    pending.clear();
    if (keep) {
      queue.add(retained);
      pending.add(retained.event());
    }
    return drained;
  }

  int size() {
    return queue.size();
  }

  boolean isEmpty() {
    return queue.isEmpty();
  }
}
