package dk.cloudcreate.essentials.components.eventsourced.aggregates;

/**
 * Thrown when an operation would silently discard events that have been raised but not yet taken for persistence
 */
public class AggregateHasRecordedEventsException extends AggregateException {
    public AggregateHasRecordedEventsException(String message) {
        super(message);
    }
}
