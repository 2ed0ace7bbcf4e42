package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStoreException;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate is requested at a version that its stream hasn't reached
 */
public class AggregateVersionException extends EventStoreException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;
    public final long     requestedVersion;
    public final long     actualVersion;

    public AggregateVersionException(UUID aggregateId, Class<?> aggregateType, long requestedVersion, long actualVersion) {
        super(msg("Requested version {} of '{}' with id '{}' but only {} event(s) are available",
                  requestedVersion,
                  aggregateType.getName(),
                  aggregateId,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.requestedVersion = requestedVersion;
        this.actualVersion = actualVersion;
    }
}
