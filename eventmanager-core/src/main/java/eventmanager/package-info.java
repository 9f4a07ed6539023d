/**
 * Root API of the event manager: a single-threaded, in-process event dispatcher with
 * prioritized handlers and a prioritized event queue.
 *
 * <h2>Core Design</h2>
 * <p>Event types are identified by an {@link eventmanager.EventTypeId}, a 32-bit value
 * obtained by hashing the type name with {@linkplain eventmanager.hash.Murmur3 Murmur3}
 * under a fixed seed, so identifiers agree across runs and processes. {@link eventmanager.Handler}s
 * are registered per type with a priority and an identity key; within a type they run
 * highest priority first, ties broken by key. {@link eventmanager.Event}s carry their own
 * priority level, which orders the pending queue independently of handler priorities.
 *
 * <p>{@link eventmanager.dispatch.EventDispatcher#processEvents()} drains the queue to empty,
 * including events pushed by handlers along the way.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventmanager-core</b> — hashing, event model, registry, dispatcher</li>
 *   <li><b>eventmanager-micrometer</b> — Micrometer {@link eventmanager.spi.MetricsExporter}</li>
 *   <li><b>eventmanager-spring-boot-starter</b> — auto-configuration and annotation-driven
 *       handler registration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (EventDispatcher dispatcher = EventDispatcher.builder().build()) {
 *     dispatcher.addHandler("PlayerJoined", Handler.of(10, "greeter", event ->
 *         System.out.println("Welcome " + event.payload().map(Payload::render).orElse("?"))));
 *
 *     dispatcher.pushEvent(Event.builder("PlayerJoined")
 *         .priorityLevel(5)
 *         .payload(TextPayload.of("alice"))
 *         .build());
 *
 *     dispatcher.processEvents();
 * }
 * }</pre>
 *
 * @see eventmanager.Event
 * @see eventmanager.EventTypeId
 * @see eventmanager.Handler
 * @see eventmanager.dispatch.EventDispatcher
 */
package eventmanager;
