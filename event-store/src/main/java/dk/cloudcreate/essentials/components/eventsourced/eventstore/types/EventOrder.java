package dk.cloudcreate.essentials.components.eventsourced.eventstore.types;

import dk.cloudcreate.essentials.types.LongType;

/**
 * Each event has its own unique position within its stream, also known as the event-order,
 * which defines the order in which the events were appended to the stream.<br>
 * The first event in a stream has event order {@link #FIRST_EVENT_ORDER}, so the version of a stream (the number of events in it)
 * is always the event order of the last event + 1
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * The {@link EventOrder} of the FIRST Event appended to a stream
     */
    public static final EventOrder FIRST_EVENT_ORDER = EventOrder.of(0);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(value() + 1);
    }
}
