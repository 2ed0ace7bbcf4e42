package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an event is routed but no route has been registered for its type
 */
public class NoEventRouteException extends AggregateException {
    public final Class<?> eventType;

    public NoEventRouteException(Class<?> eventType) {
        super(msg("No route has been registered for event type '{}'", eventType.getName()));
        this.eventType = eventType;
    }
}
