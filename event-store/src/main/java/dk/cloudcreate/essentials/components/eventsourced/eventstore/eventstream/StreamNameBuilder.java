package dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream;

import java.util.UUID;

/**
 * Strategy for naming the stream that contains the events of a given aggregate instance
 */
public interface StreamNameBuilder {
    /**
     * Generate the name of the stream containing the events of an aggregate instance
     *
     * @param aggregateType the aggregate implementation type
     * @param aggregateId   the id of the aggregate instance
     * @return the stream name
     */
    StreamName generateForAggregate(Class<?> aggregateType, UUID aggregateId);
}
