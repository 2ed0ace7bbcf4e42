package dk.cloudcreate.essentials.components.eventsourced.aggregates;

public class AggregateHasNoHistoryException extends AggregateException {
    public AggregateHasNoHistoryException(String message) {
        super(message);
    }
}
