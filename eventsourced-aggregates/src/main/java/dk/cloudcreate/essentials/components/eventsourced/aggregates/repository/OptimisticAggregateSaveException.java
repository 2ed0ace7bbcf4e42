package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStoreException;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.OptimisticAppendToStreamException;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate is saved or deleted, but its stream has been changed by another writer since the aggregate was loaded.<br>
 * The stream is left unchanged. Reload the aggregate and retry the operation
 */
public class OptimisticAggregateSaveException extends EventStoreException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;
    public final long     expectedVersion;
    public final long     actualVersion;

    public OptimisticAggregateSaveException(UUID aggregateId, Class<?> aggregateType, OptimisticAppendToStreamException cause) {
        super(msg("Expected '{}' with id '{}' to be at version {} in the EventStore but found version {}",
                  aggregateType.getName(),
                  aggregateId,
                  cause.expectedVersion,
                  cause.actualVersion),
              cause);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.expectedVersion = cause.expectedVersion;
        this.actualVersion = cause.actualVersion;
    }
}
