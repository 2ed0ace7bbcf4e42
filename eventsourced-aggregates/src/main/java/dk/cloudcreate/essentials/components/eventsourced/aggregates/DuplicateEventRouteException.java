package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when more than one route is registered for the same event type
 */
public class DuplicateEventRouteException extends AggregateException {
    public final Class<?> eventType;

    public DuplicateEventRouteException(Class<?> eventType) {
        super(msg("A route for event type '{}' has already been registered", eventType.getName()));
        this.eventType = eventType;
    }
}
