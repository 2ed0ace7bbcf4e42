package dk.cloudcreate.essentials.components.common.types;

import dk.cloudcreate.essentials.types.*;

import java.util.UUID;

/**
 * Unique id of a single message (command or event).<br>
 * A new {@link MessageId} is generated for every message created, which is why the {@link MessageId} of a message
 * is also used as the causation id of every message the first message causes.
 */
public class MessageId extends CharSequenceType<MessageId> implements Identifier {
    public MessageId(CharSequence value) {
        super(value);
    }

    public MessageId(String value) {
        super(value);
    }

    public static MessageId random() {
        return new MessageId(UUID.randomUUID().toString());
    }

    public static MessageId of(CharSequence value) {
        return new MessageId(value);
    }
}
