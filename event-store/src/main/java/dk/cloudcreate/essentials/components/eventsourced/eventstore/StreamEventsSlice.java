package dk.cloudcreate.essentials.components.eventsourced.eventstore;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.PersistedEvent;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The result of {@link EventStore#readStreamForward(StreamName, long, int)}
 */
public final class StreamEventsSlice {
    private final StreamName           streamName;
    private final StreamState          status;
    private final long                 fromEventOrder;
    private final List<PersistedEvent> events;
    private final long                 nextEventOrder;
    private final boolean              endOfStream;

    private StreamEventsSlice(StreamName streamName,
                              StreamState status,
                              long fromEventOrder,
                              List<PersistedEvent> events,
                              long nextEventOrder,
                              boolean endOfStream) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.status = requireNonNull(status, "No status provided");
        this.fromEventOrder = fromEventOrder;
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
        this.nextEventOrder = nextEventOrder;
        this.endOfStream = endOfStream;
    }

    public static StreamEventsSlice notFound(StreamName streamName, long fromEventOrder) {
        return new StreamEventsSlice(streamName, StreamState.NOT_FOUND, fromEventOrder, List.of(), fromEventOrder, true);
    }

    public static StreamEventsSlice of(StreamName streamName,
                                       boolean deleted,
                                       long fromEventOrder,
                                       List<PersistedEvent> events,
                                       boolean endOfStream) {
        return new StreamEventsSlice(streamName,
                                     deleted ? StreamState.DELETED : StreamState.EXISTS,
                                     fromEventOrder,
                                     events,
                                     fromEventOrder + events.size(),
                                     endOfStream);
    }

    public StreamName streamName() {
        return streamName;
    }

    public StreamState status() {
        return status;
    }

    public long fromEventOrder() {
        return fromEventOrder;
    }

    public List<PersistedEvent> events() {
        return events;
    }

    /**
     * The event order to read from to get the next slice
     */
    public long nextEventOrder() {
        return nextEventOrder;
    }

    public boolean isEndOfStream() {
        return endOfStream;
    }

    @Override
    public String toString() {
        return "StreamEventsSlice{" +
                "streamName=" + streamName +
                ", status=" + status +
                ", fromEventOrder=" + fromEventOrder +
                ", events=" + events.size() +
                ", nextEventOrder=" + nextEventOrder +
                ", endOfStream=" + endOfStream +
                '}';
    }
}
