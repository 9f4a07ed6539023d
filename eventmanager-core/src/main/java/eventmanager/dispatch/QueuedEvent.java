package eventmanager.dispatch;

import eventmanager.Event;

/**
 * Internal wrapper pairing an {@link Event} with its enqueue sequence number.
 * The sequence gives FIFO order among events with the same priority level.
 */
record QueuedEvent(Event event, long sequence) {
}
