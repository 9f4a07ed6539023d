/**
 * Handler routing by {@link eventmanager.EventTypeId}.
 *
 * <p>Each identifier maps to an ordered set of {@link eventmanager.Handler}s. Events whose
 * type has no handlers are dropped by the dispatcher.
 *
 * @see eventmanager.registry.HandlerRegistry
 * @see eventmanager.registry.DefaultHandlerRegistry
 */
package eventmanager.registry;
