package dk.cloudcreate.essentials.components.eventsourced.aggregates.correlated;

import dk.cloudcreate.essentials.components.eventsourced.aggregates.AggregateException;

/**
 * Thrown when an event cannot be correlated with the source of a {@link CorrelatedAggregateRoot}
 */
public class CorrelationException extends AggregateException {
    public CorrelationException(String message) {
        super(message);
    }
}
