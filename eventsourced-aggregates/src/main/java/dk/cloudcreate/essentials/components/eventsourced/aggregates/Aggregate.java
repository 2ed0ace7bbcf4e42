package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import java.util.*;

/**
 * Common interface for event sourced aggregates. Most concrete implementations choose to extend the {@link EventDrivenStateMachine} class.
 * <p>
 * The {@link #version()} of an aggregate is the number of events applied to it that are either historic (restored)
 * or have been taken for persistence using {@link #takeEvents()}. Events raised but not yet taken are reported through {@link #hasRecordedEvents()}.
 *
 * @see EventDrivenStateMachine
 */
public interface Aggregate {
    /**
     * The id of the aggregate
     *
     * @throws IllegalArgumentException if no aggregate id has been assigned yet
     */
    UUID aggregateId();

    /**
     * Has an aggregate id been assigned using {@link #initializeAggregateId(UUID)}
     */
    boolean hasAggregateId();

    /**
     * Assign the id of the aggregate. The id can only be assigned once, assigning the same id again is allowed
     *
     * @param aggregateId the aggregate id
     * @throws AggregateIdAlreadyAssignedException in case the aggregate already has a different id
     */
    void initializeAggregateId(UUID aggregateId);

    /**
     * The number of events applied to this aggregate (historic events plus events taken using {@link #takeEvents()})
     */
    long version();

    /**
     * Does the aggregate contain events that have been raised but not yet taken using {@link #takeEvents()}
     */
    boolean hasRecordedEvents();

    /**
     * Apply historic events to the aggregate
     *
     * @param events the historic events, in the order they were persisted
     * @throws AggregateHasRecordedEventsException in case the aggregate has recorded events
     * @throws NoEventRouteException               in case an event type hasn't been registered
     */
    void restoreFromEvents(List<?> events);

    /**
     * Fast forward the aggregate with events that other writers have appended since it was loaded
     *
     * @param events          the new events
     * @param expectedVersion the version the aggregate MUST have
     * @throws AggregateHasRecordedEventsException in case the aggregate has recorded events that haven't been taken
     * @throws AggregateHasNoHistoryException      in case the aggregate hasn't been restored from any events
     * @throws AggregateVersionConflictException  in case <code>expectedVersion</code> is different from {@link #version()}
     */
    void updateWithEvents(List<?> events, long expectedVersion);

    /**
     * Take (and clear) the recorded events. The {@link #version()} is increased by the number of events taken
     *
     * @return the recorded events in the order they were raised
     */
    List<Object> takeEvents();
}
