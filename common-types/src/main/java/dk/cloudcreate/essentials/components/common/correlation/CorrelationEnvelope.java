package dk.cloudcreate.essentials.components.common.correlation;

import dk.cloudcreate.essentials.components.common.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable (message id, correlation id, causation id) triple attached to every command and event.<br>
 * Use {@link #newChain()} to start a new business transaction and {@link #from(CorrelatedMessage)} to derive the envelope
 * of a message that is caused by another message.
 */
public final class CorrelationEnvelope implements CorrelatedMessage {
    private final MessageId     messageId;
    private final CorrelationId correlationId;
    private final MessageId     causationId;

    public CorrelationEnvelope(MessageId messageId, CorrelationId correlationId, MessageId causationId) {
        this.messageId = requireNonNull(messageId, "No messageId provided");
        this.correlationId = requireNonNull(correlationId, "No correlationId provided");
        this.causationId = requireNonNull(causationId, "No causationId provided");
    }

    /**
     * Start a new correlation chain: message id, correlation id and causation id all share the same freshly generated value
     *
     * @return the envelope for the first message in a new chain
     */
    public static CorrelationEnvelope newChain() {
        var messageId = MessageId.random();
        return new CorrelationEnvelope(messageId,
                                       CorrelationId.startingWith(messageId),
                                       messageId);
    }

    /**
     * Derive the envelope for a message caused by <code>source</code>.<br>
     * The correlation id is inherited from <code>source</code>, the causation id is the <code>source</code>'s message id and the
     * message id is freshly generated
     *
     * @param source the message that causes the new message
     * @return the derived envelope
     */
    public static CorrelationEnvelope from(CorrelatedMessage source) {
        requireNonNull(source, "You must supply a source message");
        return new CorrelationEnvelope(MessageId.random(),
                                       requireNonNull(source.correlationId(), "The source message doesn't have a correlationId"),
                                       requireNonNull(source.messageId(), "The source message doesn't have a messageId"));
    }

    /**
     * Copy the envelope values of an existing message
     */
    public static CorrelationEnvelope of(CorrelatedMessage message) {
        requireNonNull(message, "You must supply a message");
        if (message instanceof CorrelationEnvelope) {
            return (CorrelationEnvelope) message;
        }
        return new CorrelationEnvelope(message.messageId(),
                                       message.correlationId(),
                                       message.causationId());
    }

    /**
     * Is this the envelope of the first message in a chain (i.e. it wasn't caused by another message)
     */
    public boolean isRootOfChain() {
        return messageId.equals(causationId);
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CorrelationEnvelope)) return false;
        CorrelationEnvelope that = (CorrelationEnvelope) o;
        return messageId.equals(that.messageId) &&
                correlationId.equals(that.correlationId) &&
                causationId.equals(that.causationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, correlationId, causationId);
    }

    @Override
    public String toString() {
        return "CorrelationEnvelope{" +
                "messageId=" + messageId +
                ", correlationId=" + correlationId +
                ", causationId=" + causationId +
                '}';
    }
}
