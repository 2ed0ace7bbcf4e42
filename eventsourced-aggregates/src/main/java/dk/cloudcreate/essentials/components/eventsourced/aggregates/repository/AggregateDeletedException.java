package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStoreException;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when the stream of the aggregate has been soft deleted
 */
public class AggregateDeletedException extends EventStoreException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;

    public AggregateDeletedException(UUID aggregateId, Class<?> aggregateType) {
        super(msg("The '{}' aggregate with id '{}' has been deleted", aggregateType.getName(), aggregateId));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }

    public AggregateDeletedException(UUID aggregateId, Class<?> aggregateType, Throwable cause) {
        super(msg("The '{}' aggregate with id '{}' has been deleted", aggregateType.getName(), aggregateId), cause);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
