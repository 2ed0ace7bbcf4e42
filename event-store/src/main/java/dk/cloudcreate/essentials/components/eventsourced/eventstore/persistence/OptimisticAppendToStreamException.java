package dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a write to a stream is rejected because the stream's version isn't the expected version,
 * i.e. another writer has changed the stream in the meantime
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public final StreamName streamName;
    public final long       expectedVersion;
    public final long       actualVersion;

    public OptimisticAppendToStreamException(StreamName streamName, long expectedVersion, long actualVersion) {
        super(msg("Stream '{}' is at version {} but the expected version was {}",
                  streamName,
                  actualVersion,
                  expectedVersion));
        this.streamName = streamName;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
