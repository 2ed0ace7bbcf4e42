package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by {@link Aggregate#updateWithEvents(java.util.List, long)} when the aggregate's version differs from the expected version
 */
public class AggregateVersionConflictException extends AggregateException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;
    public final long     expectedVersion;
    public final long     actualVersion;

    public AggregateVersionConflictException(UUID aggregateId, Class<?> aggregateType, long expectedVersion, long actualVersion) {
        super(msg("Expected '{}' with id '{}' to be at version {} but it is at version {}",
                  aggregateType.getName(),
                  aggregateId,
                  expectedVersion,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
