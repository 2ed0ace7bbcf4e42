package dk.cloudcreate.essentials.components.eventsourced.aggregates.correlated;

import dk.cloudcreate.essentials.components.common.correlation.*;
import dk.cloudcreate.essentials.components.eventsourced.aggregates.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventDrivenStateMachine} where every raised event is part of the correlation chain of the message (the <b>source</b>)
 * that caused it.<br>
 * Every event raised MUST be a {@link CorrelatedEvent}. An event that hasn't been correlated when it's raised is correlated using
 * {@link CorrelationEnvelope#from(CorrelatedMessage)} with the current {@link #source()} (or the source passed to
 * {@link #raiseCorrelated(CorrelatedEvent, CorrelatedMessage)}), which guarantees that the event's correlation id is the
 * source's correlation id and the event's causation id is the source's message id.
 * <p>
 * The source is cleared when the recorded events have been taken using {@link #takeEvents()}
 */
public abstract class CorrelatedAggregateRoot extends EventDrivenStateMachine {
    private static final Logger log = LoggerFactory.getLogger(CorrelatedAggregateRoot.class);

    private CorrelatedMessage source;
    private CorrelatedMessage raisingOnBehalfOf;

    /**
     * The message that causes the events currently being raised
     */
    public Optional<CorrelatedMessage> source() {
        return Optional.ofNullable(source);
    }

    /**
     * Set the message that causes the events raised from now on
     *
     * @param source the source message
     * @throws CorrelationException in case events raised under a different source are still recorded
     */
    public void source(CorrelatedMessage source) {
        requireNonNull(source, "No source provided");
        if (this.source != null && hasRecordedEvents() && !CorrelationEnvelope.of(this.source).equals(CorrelationEnvelope.of(source))) {
            throw new CorrelationException(msg("Cannot change the source of '{}' with id '{}' while it has events recorded under source '{}'",
                                               getClass().getName(),
                                               hasAggregateId() ? aggregateId() : null,
                                               this.source.messageId()));
        }
        this.source = source;
    }

    /**
     * Raise <code>event</code> as caused by <code>source</code>.<br>
     * <code>source</code> only applies to this event, the aggregate's current {@link #source()} is left untouched, so events caused by
     * different messages can be raised before the recorded events are taken
     *
     * @param event  the event
     * @param source the message that caused the event
     */
    protected void raiseCorrelated(CorrelatedEvent event, CorrelatedMessage source) {
        requireNonNull(event, "No event provided");
        requireNonNull(source, "No source provided");
        raisingOnBehalfOf = source;
        try {
            raise(event);
        } finally {
            raisingOnBehalfOf = null;
        }
    }

    /**
     * Fast forward the aggregate with events appended by other writers and make <code>source</code> the current source
     *
     * @param events          the new events
     * @param expectedVersion the version the aggregate MUST have
     * @param source          the message that caused the update
     * @throws AggregateHasRecordedEventsException in case the aggregate has recorded events that haven't been taken
     */
    public void updateWithEvents(List<?> events, long expectedVersion, CorrelatedMessage source) {
        requireNonNull(source, "No source provided");
        updateWithEvents(events, expectedVersion);
        // no recorded events at this point, so the source can always be replaced
        this.source = source;
        log.debug("Updated '{}' with id '{}' to version {} from source with message id '{}' and correlation id '{}'",
                  getClass().getName(),
                  hasAggregateId() ? aggregateId() : null,
                  version(),
                  source.messageId(),
                  source.correlationId());
    }

    @Override
    protected void onEventRaised(Object event) {
        if (!(event instanceof CorrelatedEvent)) {
            throw new CorrelationException(msg("Cannot raise uncorrelated event '{}' from correlated aggregate '{}'",
                                               event.getClass().getName(),
                                               getClass().getName()));
        }
        var source = raisingOnBehalfOf != null ? raisingOnBehalfOf : this.source;
        if (source == null) {
            throw new CorrelationException(msg("Cannot raise event '{}' from '{}' without a source",
                                               event.getClass().getName(),
                                               getClass().getName()));
        }
        var correlatedEvent = (CorrelatedEvent) event;
        if (!correlatedEvent.isCorrelated()) {
            correlatedEvent.correlateWith(CorrelationEnvelope.from(source));
        } else if (!correlatedEvent.isCausedBy(source)) {
            throw new CorrelationException(msg("Cannot raise event '{}' with correlation id '{}' and causation id '{}' as it wasn't caused by the source with message id '{}' and correlation id '{}'",
                                               event.getClass().getName(),
                                               correlatedEvent.correlationId(),
                                               correlatedEvent.causationId(),
                                               source.messageId(),
                                               source.correlationId()));
        }
    }

    @Override
    protected void takeEventsCompleted() {
        source = null;
    }
}
