package dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.types.EventOrder;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event that has been appended to a stream
 */
public final class PersistedEvent extends PersistableEvent {
    private final StreamName     streamName;
    private final EventOrder     eventOrder;
    private final OffsetDateTime timestamp;

    public PersistedEvent(StreamName streamName,
                          EventOrder eventOrder,
                          OffsetDateTime timestamp,
                          PersistableEvent event) {
        super(requireNonNull(event, "No event provided").eventId(),
              event.eventType(),
              event.jsonData(),
              event.jsonMetaData());
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public StreamName streamName() {
        return streamName;
    }

    /**
     * The (zero based) position of the event within its stream
     */
    public EventOrder eventOrder() {
        return eventOrder;
    }

    /**
     * When the event was appended (UTC)
     */
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "eventId=" + eventId() +
                ", eventType='" + eventType() + '\'' +
                ", streamName=" + streamName +
                ", eventOrder=" + eventOrder +
                ", timestamp=" + timestamp +
                '}';
    }
}
