/**
 * Priority event queue and synchronous dispatcher.
 *
 * <p>{@link eventmanager.dispatch.EventDispatcher} drains pending events highest priority
 * level first and invokes each event's handler set in handler priority order. Supports
 * interceptors, a configurable handler-failure policy, and an optional drain budget.
 *
 * @see eventmanager.dispatch.EventDispatcher
 * @see eventmanager.dispatch.EventInterceptor
 * @see eventmanager.dispatch.HandlerFailurePolicy
 */
package eventmanager.dispatch;
