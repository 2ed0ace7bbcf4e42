package dk.cloudcreate.essentials.components.eventsourced.eventstore;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class StreamNotFoundException extends EventStoreException {
    public final StreamName streamName;

    public StreamNotFoundException(StreamName streamName) {
        super(msg("Stream '{}' doesn't exist", streamName));
        this.streamName = streamName;
    }
}
