package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import org.slf4j.*;

import java.util.*;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for event sourced aggregates (and process managers) that combines an {@link EventRouter} with an {@link EventRecorder}.
 * <p>
 * A concrete aggregate registers a route per event type in its constructor, using {@link #register(Class, Consumer)}, and changes its
 * state exclusively by raising events using {@link #raise(Object)}:
 * <pre>{@code
 * public class Account extends EventDrivenStateMachine {
 *     private BigDecimal balance;
 *
 *     public Account() {
 *         register(AccountOpened.class, e -> {
 *             initializeAggregateId(e.accountId);
 *             balance = BigDecimal.ZERO;
 *         });
 *         register(AmountDeposited.class, e -> balance = balance.add(e.amount));
 *     }
 *
 *     public void deposit(BigDecimal amount) {
 *         raise(new AmountDeposited(amount));
 *     }
 * }
 * }</pre>
 * The {@link #version()} only changes when events are restored/updated or when recorded events are taken using {@link #takeEvents()},
 * i.e. raising an event doesn't change the version until the event is handed over for persistence.
 */
public abstract class EventDrivenStateMachine implements Aggregate {
    private static final Logger log = LoggerFactory.getLogger(EventDrivenStateMachine.class);

    /**
     * The {@link #version()} of an aggregate that hasn't had any events applied
     */
    public static final long NO_EVENTS_HAVE_BEEN_APPLIED = 0;

    private final EventRouter   router   = new EventRouter();
    private final EventRecorder recorder = new EventRecorder();
    private       UUID          aggregateId;
    private       long          version  = NO_EVENTS_HAVE_BEEN_APPLIED;

    /**
     * Register the logic that applies events of type <code>eventType</code> to this aggregate.<br>
     * Must be called from the constructor, before any events are applied
     *
     * @param eventType the exact event type
     * @param route     the logic that applies the event
     * @param <E>       the event type
     * @throws DuplicateEventRouteException in case a route has already been registered for <code>eventType</code>
     */
    protected <E> void register(Class<E> eventType, Consumer<? super E> route) {
        router.registerRoute(eventType, route);
    }

    @Override
    public UUID aggregateId() {
        requireNonNull(aggregateId, msg("No aggregate id has been assigned to '{}'", getClass().getName()));
        return aggregateId;
    }

    @Override
    public boolean hasAggregateId() {
        return aggregateId != null;
    }

    @Override
    public void initializeAggregateId(UUID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        if (this.aggregateId != null && !this.aggregateId.equals(aggregateId)) {
            throw new AggregateIdAlreadyAssignedException(getClass(), this.aggregateId, aggregateId);
        }
        this.aggregateId = aggregateId;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public boolean hasRecordedEvents() {
        return recorder.hasRecordedEvents();
    }

    @Override
    public void restoreFromEvents(List<?> events) {
        requireNonNull(events, "No events provided");
        for (var event : events) {
            restoreFromEvent(event);
        }
    }

    /**
     * Apply a single historic event to the aggregate
     *
     * @param event the historic event
     * @throws AggregateHasRecordedEventsException in case the aggregate has recorded events
     * @throws NoEventRouteException               in case the event type hasn't been registered
     */
    public void restoreFromEvent(Object event) {
        requireNonNull(event, "No event provided");
        if (recorder.hasRecordedEvents()) {
            throw new AggregateHasRecordedEventsException(msg("Cannot restore '{}' from events while it has recorded events", getClass().getName()));
        }
        router.route(event);
        version++;
    }

    @Override
    public void updateWithEvents(List<?> events, long expectedVersion) {
        requireNonNull(events, "No events provided");
        if (recorder.hasRecordedEvents()) {
            throw new AggregateHasRecordedEventsException(msg("Cannot update '{}' with events while it has recorded events", getClass().getName()));
        }
        if (version == NO_EVENTS_HAVE_BEEN_APPLIED) {
            throw new AggregateHasNoHistoryException(msg("Cannot update '{}' with events as it hasn't been restored from any historic events", getClass().getName()));
        }
        if (expectedVersion != version) {
            throw new AggregateVersionConflictException(aggregateId, getClass(), expectedVersion, version);
        }
        for (var event : events) {
            router.route(requireNonNull(event, "events contains a null element"));
            version++;
        }
        log.trace("Updated '{}' with id '{}' with {} event(s) to version {}", getClass().getName(), aggregateId, events.size(), version);
    }

    /**
     * Apply a new event to the aggregate and record it, so it can be taken for persistence using {@link #takeEvents()}.<br>
     * {@link #onEventRaised(Object)} is called before the event is applied, but only once a route for the event is known to exist
     *
     * @param event the new event
     * @throws NoEventRouteException in case the event type hasn't been registered
     */
    protected void raise(Object event) {
        requireNonNull(event, "No event provided");
        if (!router.hasRouteFor(event.getClass())) {
            throw new NoEventRouteException(event.getClass());
        }
        onEventRaised(event);
        router.route(event);
        recorder.record(event);
    }

    @Override
    public List<Object> takeEvents() {
        takeEventsStarted();
        var events = recorder.drain();
        version += events.size();
        takeEventsCompleted();
        return events;
    }

    /**
     * Called with every event passed to {@link #raise(Object)}, before the event is applied
     */
    protected void onEventRaised(Object event) {
    }

    /**
     * Called by {@link #takeEvents()} before the recorded events are taken
     */
    protected void takeEventsStarted() {
    }

    /**
     * Called by {@link #takeEvents()} after the recorded events have been taken and the version updated
     */
    protected void takeEventsCompleted() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId +
                ", version=" + version +
                ", hasRecordedEvents=" + recorder.hasRecordedEvents() +
                '}';
    }
}
