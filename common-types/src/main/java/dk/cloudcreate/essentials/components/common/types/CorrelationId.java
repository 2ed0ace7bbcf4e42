package dk.cloudcreate.essentials.components.common.types;

import dk.cloudcreate.essentials.types.*;

/**
 * Identifies the end-to-end business transaction a message belongs to.<br>
 * All messages (commands and events) that are the result of the same initial message share the same {@link CorrelationId}
 */
public class CorrelationId extends CharSequenceType<CorrelationId> implements Identifier {
    public CorrelationId(CharSequence value) {
        super(value);
    }

    public CorrelationId(String value) {
        super(value);
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    /**
     * The {@link CorrelationId} of the first message in a chain is the same as the {@link MessageId} of that message
     *
     * @param messageId the id of the message that starts a new chain
     * @return the correlation id for the new chain
     */
    public static CorrelationId startingWith(MessageId messageId) {
        return new CorrelationId(messageId);
    }
}
