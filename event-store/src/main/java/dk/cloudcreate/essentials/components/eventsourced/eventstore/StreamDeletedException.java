package dk.cloudcreate.essentials.components.eventsourced.eventstore;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when writing to (or deleting) a stream that has been soft deleted
 */
public class StreamDeletedException extends EventStoreException {
    public final StreamName streamName;

    public StreamDeletedException(StreamName streamName) {
        super(msg("Stream '{}' has been deleted", streamName));
        this.streamName = streamName;
    }
}
