package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStoreException;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when no stream exists for the aggregate (it was never saved or it has been hard deleted)
 */
public class AggregateNotFoundException extends EventStoreException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;

    public AggregateNotFoundException(UUID aggregateId, Class<?> aggregateType) {
        super(msg("Couldn't find a '{}' aggregate with id '{}'", aggregateType.getName(), aggregateId));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }

    public AggregateNotFoundException(UUID aggregateId, Class<?> aggregateType, Throwable cause) {
        super(msg("Couldn't find a '{}' aggregate with id '{}'", aggregateType.getName(), aggregateId), cause);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
