package dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream;

import dk.cloudcreate.essentials.types.*;

/**
 * The name of an event stream. Each aggregate instance has its own stream
 *
 * @see StreamNameBuilder
 */
public class StreamName extends CharSequenceType<StreamName> implements Identifier {
    public StreamName(CharSequence value) {
        super(value);
    }

    public StreamName(String value) {
        super(value);
    }

    public static StreamName of(CharSequence value) {
        return new StreamName(value);
    }
}
