package dk.cloudcreate.essentials.components.eventsourced.aggregates.correlated;

import dk.cloudcreate.essentials.components.common.correlation.*;
import dk.cloudcreate.essentials.components.common.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for events raised by a {@link CorrelatedAggregateRoot}.<br>
 * An event can either be created with a {@link CorrelationEnvelope} (e.g. using {@link MessageBuilder#from(CorrelatedMessage, java.util.function.Function)})
 * or without one, in which case the {@link CorrelatedAggregateRoot} correlates the event with its current source when the event is raised.<br>
 * Once correlated, the correlation values of an event never change.
 * <p>
 * Concrete events need a no-arguments constructor (it may be protected) so they can be deserialized
 */
public abstract class CorrelatedEvent implements CorrelatedMessage {
    private MessageId     messageId;
    private CorrelationId correlationId;
    private MessageId     causationId;

    /**
     * Create an event that will be correlated when it is raised
     */
    protected CorrelatedEvent() {
    }

    protected CorrelatedEvent(CorrelationEnvelope envelope) {
        correlateWith(requireNonNull(envelope, "No envelope provided"));
    }

    /**
     * Has the event been assigned its correlation values
     */
    public boolean isCorrelated() {
        return messageId != null;
    }

    /**
     * Is this event caused by <code>source</code>, i.e. does it belong to the same correlation chain and is its causation id the message id of <code>source</code>
     */
    public boolean isCausedBy(CorrelatedMessage source) {
        requireNonNull(source, "No source provided");
        return isCorrelated() &&
                correlationId.equals(source.correlationId()) &&
                causationId.equals(source.messageId());
    }

    void correlateWith(CorrelationEnvelope envelope) {
        if (isCorrelated()) {
            throw new CorrelationException(msg("Event '{}' with message id '{}' has already been correlated",
                                               getClass().getName(),
                                               messageId));
        }
        this.messageId = envelope.messageId();
        this.correlationId = envelope.correlationId();
        this.causationId = envelope.causationId();
    }

    @Override
    public MessageId messageId() {
        return messageId;
    }

    @Override
    public CorrelationId correlationId() {
        return correlationId;
    }

    @Override
    public MessageId causationId() {
        return causationId;
    }
}
