package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateIdAlreadyAssignedException extends AggregateException {
    public final Class<?> aggregateType;
    public final UUID     assignedAggregateId;
    public final UUID     rejectedAggregateId;

    public AggregateIdAlreadyAssignedException(Class<?> aggregateType, UUID assignedAggregateId, UUID rejectedAggregateId) {
        super(msg("'{}' already has aggregate id '{}' and cannot be assigned aggregate id '{}'",
                  aggregateType.getName(),
                  assignedAggregateId,
                  rejectedAggregateId));
        this.aggregateType = aggregateType;
        this.assignedAggregateId = assignedAggregateId;
        this.rejectedAggregateId = rejectedAggregateId;
    }
}
