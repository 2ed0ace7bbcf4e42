package dk.cloudcreate.essentials.components.common.correlation;

import dk.cloudcreate.essentials.components.common.types.*;

/**
 * A message (command or event) that participates in a correlation chain.<br>
 * <ul>
 *     <li>{@link #messageId()} is unique for every message</li>
 *     <li>{@link #correlationId()} is shared by every message belonging to the same business transaction</li>
 *     <li>{@link #causationId()} is the {@link #messageId()} of the message that directly caused this message</li>
 * </ul>
 * The first message in a chain has all three values equal to its own {@link #messageId()}
 *
 * @see CorrelationEnvelope
 * @see MessageBuilder
 */
public interface CorrelatedMessage {
    /**
     * The unique id of this message
     */
    MessageId messageId();

    /**
     * The id of the business transaction this message belongs to
     */
    CorrelationId correlationId();

    /**
     * The {@link #messageId()} of the message that caused this message
     */
    MessageId causationId();
}
