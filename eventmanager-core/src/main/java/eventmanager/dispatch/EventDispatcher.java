package eventmanager.dispatch;

import eventmanager.Event;
import eventmanager.EventType;
import eventmanager.EventTypeId;
import eventmanager.Handler;
import eventmanager.registry.DefaultHandlerRegistry;
import eventmanager.registry.HandlerRegistry;
import eventmanager.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process event dispatcher with prioritized handlers and a prioritized event queue.
 *
 * <p>Handlers are registered per event type with {@link #addHandler}; events are enqueued
 * with {@link #pushEvent} and dispatched by {@link #processEvents()}, which drains the
 * queue highest {@linkplain Event#priorityLevel() priority level} first (FIFO among equal
 * levels) and invokes every handler of the event's type in {@link Handler#ORDER}.
 *
 * <h2>Threading</h2>
 * <p>Not thread-safe. All calls belong on one logical thread; callers sharing a dispatcher
 * across threads must guard it externally. A handler may call {@link #pushEvent} (the new
 * event is drained by the running {@code processEvents()}), {@link #addHandler} and
 * {@link #removeHandler} (effective from the next event, since each event iterates a
 * snapshot of its handler set). A handler may not call {@code processEvents()}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see EventDispatcher.Builder
 * @see HandlerRegistry
 * @see EventInterceptor
 */
public final class EventDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private final EventQueue queue = new EventQueue();
  private final HandlerRegistry registry;
  private final MetricsExporter metrics;
  private final List<EventInterceptor> interceptors;
  private final HandlerFailurePolicy failurePolicy;
  private final int maxEventsPerDrain;

  private boolean draining;
  private boolean closed;
  private QueuedEvent inFlight;

  private EventDispatcher(Builder builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultHandlerRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.failurePolicy = Objects.requireNonNull(builder.failurePolicy, "failurePolicy");

    if (builder.maxEventsPerDrain < 0) {
      throw new IllegalArgumentException("maxEventsPerDrain must be >= 0");
    }
    this.maxEventsPerDrain = builder.maxEventsPerDrain;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registers a handler for an event type name.
   *
   * @param eventType the event type name, hashed into an {@link EventTypeId}
   * @param handler   the handler
   * @return {@code true} if added, {@code false} if an equal handler was already registered
   */
  public boolean addHandler(String eventType, Handler handler) {
    return addHandler(EventTypeId.of(eventType), handler);
  }

  public boolean addHandler(EventType eventType, Handler handler) {
    return addHandler(EventTypeId.of(eventType), handler);
  }

  public boolean addHandler(int eventTypeId, Handler handler) {
    return addHandler(EventTypeId.fromValue(eventTypeId), handler);
  }

  /**
   * Registers a handler for an event type.
   *
   * <p>A handler with the same priority and key as one already registered for this type is
   * not added again; this is not an error.
   *
   * @param eventType the event type identifier
   * @param handler   the handler
   * @return {@code true} if added, {@code false} if an equal handler was already registered
   */
  public boolean addHandler(EventTypeId eventType, Handler handler) {
    boolean added = registry.add(eventType, handler);
    if (!added && logger.isLoggable(Level.FINE)) {
      logger.fine("Handler already registered for type " + eventType + ": " + handler);
    }
    return added;
  }

  public boolean removeHandler(String eventType, Handler handler) {
    return removeHandler(EventTypeId.of(eventType), handler);
  }

  public boolean removeHandler(EventType eventType, Handler handler) {
    return removeHandler(EventTypeId.of(eventType), handler);
  }

  public boolean removeHandler(int eventTypeId, Handler handler) {
    return removeHandler(EventTypeId.fromValue(eventTypeId), handler);
  }

  /**
   * Removes the handler equal to {@code handler} (same priority and key) from the type.
   * Unknown types and unregistered handlers are ignored.
   *
   * @param eventType the event type identifier
   * @param handler   the handler to remove
   * @return {@code true} if a handler was removed
   */
  public boolean removeHandler(EventTypeId eventType, Handler handler) {
    boolean removed = registry.remove(eventType, handler);
    if (removed && logger.isLoggable(Level.FINE)) {
      logger.fine("Removed handler with priority " + handler.priority()
          + " from type " + eventType + ": " + handler.key());
    }
    return removed;
  }

  /**
   * Returns the handlers currently registered for a type, in invocation order.
   *
   * @param eventType the event type identifier
   * @return immutable snapshot, may be empty
   */
  public List<Handler> handlers(EventTypeId eventType) {
    return registry.handlersFor(eventType);
  }

  public int handlerCount(EventTypeId eventType) {
    return registry.handlersFor(eventType).size();
  }

  /**
   * Enqueues an event. The dispatcher takes ownership of the event and its payload.
   *
   * @param event the event
   * @throws NullPointerException  if event is null
   * @throws IllegalStateException if the dispatcher has been closed, the event is already
   *                               closed, or this event instance is already pending
   */
  public void pushEvent(Event event) {
    Objects.requireNonNull(event, "event");
    if (closed) {
      throw new IllegalStateException("Dispatcher is closed; rejecting event " + event.eventId());
    }
    if (event.isClosed()) {
      throw new IllegalStateException("Event " + event.eventId() + " is closed; its payload was released");
    }
    if (queue.contains(event)) {
      throw new IllegalStateException("Event " + event.eventId() + " is already pending");
    }
    queue.offer(event);
    metrics.incrementEventsPushed();
    metrics.recordQueueDepth(queue.size());
  }

  public int pendingEvents() {
    return queue.size();
  }

  public boolean hasPendingEvents() {
    return !queue.isEmpty();
  }

  /**
   * Drains the queue until it is empty, dispatching each event to its handlers.
   *
   * <p>Each iteration takes the highest-priority pending event, invokes the handlers of its
   * type, then removes and closes it. Emptiness is re-checked every iteration, so events
   * pushed by handlers are drained by this same call. Events whose type has no handlers are
   * dropped.
   *
   * <p>Handlers that keep pushing events make this method run forever unless a
   * {@linkplain Builder#maxEventsPerDrain(int) drain budget} is configured.
   *
   * @return number of events dispatched
   * @throws IllegalStateException        if called from within a handler
   * @throws DrainBudgetExceededException if the drain budget ran out with events pending
   * @throws HandlerInvocationException   if a handler failed under
   *                                      {@link HandlerFailurePolicy#PROPAGATE}
   */
  public int processEvents() {
    if (draining) {
      throw new IllegalStateException("processEvents() is not reentrant");
    }
    draining = true;
    int dispatched = 0;
    try {
      while (!queue.isEmpty()) {
        if (maxEventsPerDrain > 0 && dispatched >= maxEventsPerDrain) {
          int remaining = queue.size();
          logger.warning("Drain budget of " + maxEventsPerDrain + " events exhausted with "
              + remaining + " events pending; handlers may be re-enqueueing without bound");
          throw new DrainBudgetExceededException(maxEventsPerDrain, remaining);
        }
        QueuedEvent entry = queue.peek();
        inFlight = entry;
        try {
          dispatch(entry.event());
        } finally {
          inFlight = null;
          queue.remove(entry);
          release(entry.event());
          metrics.recordQueueDepth(queue.size());
        }
        dispatched++;
      }
    } finally {
      draining = false;
    }
    return dispatched;
  }

  private void dispatch(Event event) {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(event);
        completedBefore = i + 1;
      }
    } catch (Exception e) {
      metrics.incrementInterceptorFailures();
      onFailure(event, null, e, completedBefore);
      runAfterDispatch(event, e, completedBefore);
      return;
    }

    List<Handler> handlers = registry.handlersFor(event.type());
    if (handlers.isEmpty()) {
      metrics.incrementEventsUnhandled();
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest("No handlers for " + event + "; dropping");
      }
      runAfterDispatch(event, null, completedBefore);
      return;
    }

    Exception lastFailure = null;
    for (Handler handler : handlers) {
      try {
        metrics.incrementHandlerInvocations();
        handler.callback().onEvent(event);
      } catch (Exception e) {
        metrics.incrementHandlerFailures();
        lastFailure = e;
        onFailure(event, handler, e, completedBefore);
      }
    }
    metrics.incrementEventsDispatched();
    runAfterDispatch(event, lastFailure, completedBefore);
  }

  private void onFailure(Event event, Handler handler, Exception failure, int completedBefore) {
    String source = handler == null ? "interceptor" : "handler " + handler.key();
    if (failurePolicy == HandlerFailurePolicy.PROPAGATE) {
      runAfterDispatch(event, failure, completedBefore);
      throw new HandlerInvocationException(event, handler, failure);
    }
    logger.log(Level.SEVERE, "Dispatch of event " + event.eventId() + " failed in " + source, failure);
  }

  private void runAfterDispatch(Event event, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(event, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  private void release(Event event) {
    try {
      event.close();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to release payload of event " + event.eventId(), e);
    }
  }

  /**
   * Discards every pending event without dispatching it. Payloads are released.
   *
   * <p>When called from a handler, the event being dispatched is not discarded: its remaining
   * handlers still run and its payload is released once they finish.
   *
   * @return number of events discarded
   */
  public int clearEvents() {
    List<Event> discarded = queue.clear(inFlight);
    for (Event event : discarded) {
      release(event);
    }
    if (!discarded.isEmpty()) {
      metrics.incrementEventsDiscarded(discarded.size());
      metrics.recordQueueDepth(queue.size());
    }
    return discarded.size();
  }

  /**
   * Discards pending events and rejects further {@link #pushEvent} calls. Registered
   * handlers are kept.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    int discarded = clearEvents();
    if (discarded > 0) {
      logger.log(Level.WARNING, "Dispatcher closed with " + discarded + " pending events discarded");
    }
  }

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private HandlerRegistry registry;
    private MetricsExporter metrics;
    private final List<EventInterceptor> interceptors = new ArrayList<>();
    private HandlerFailurePolicy failurePolicy = HandlerFailurePolicy.CONTINUE;
    private int maxEventsPerDrain;

    private Builder() {}

    /**
     * Sets the registry holding handler sets.
     *
     * <p>Optional. Defaults to a new {@link DefaultHandlerRegistry}.
     *
     * @param registry the handler registry
     * @return this builder
     */
    public Builder registry(HandlerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the metrics exporter for recording dispatch counters and queue depth.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends a single event interceptor.
     *
     * <p>Optional. Interceptors are invoked in registration order before dispatch,
     * and in reverse order after dispatch.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Appends multiple event interceptors.
     *
     * @param interceptors the interceptors to add
     * @return this builder
     */
    public Builder interceptors(List<EventInterceptor> interceptors) {
      Objects.requireNonNull(interceptors, "interceptors");
      for (EventInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets how handler failures are treated.
     *
     * <p>Optional. Defaults to {@link HandlerFailurePolicy#CONTINUE}.
     *
     * @param failurePolicy the failure policy
     * @return this builder
     */
    public Builder failurePolicy(HandlerFailurePolicy failurePolicy) {
      this.failurePolicy = failurePolicy;
      return this;
    }

    /**
     * Caps the number of events a single {@link #processEvents()} call may dispatch.
     *
     * <p>Optional. Defaults to {@code 0} (unbounded). Must be &ge; 0.
     *
     * @param maxEventsPerDrain the drain budget, or 0 for none
     * @return this builder
     */
    public Builder maxEventsPerDrain(int maxEventsPerDrain) {
      this.maxEventsPerDrain = maxEventsPerDrain;
      return this;
    }

    /**
     * Builds the dispatcher.
     *
     * @return a new {@link EventDispatcher}
     * @throws NullPointerException     if {@code failurePolicy} was set to null
     * @throws IllegalArgumentException if {@code maxEventsPerDrain < 0}
     */
    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}
