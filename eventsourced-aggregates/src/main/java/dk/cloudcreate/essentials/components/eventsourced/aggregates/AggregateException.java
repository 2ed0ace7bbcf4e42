package dk.cloudcreate.essentials.components.eventsourced.aggregates;

/**
 * Base type for errors raised by an in-memory {@link Aggregate} (routing, sequencing and version errors)
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
