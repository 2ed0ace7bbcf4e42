package dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence;

import dk.cloudcreate.essentials.components.common.types.MessageId;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStore;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.EventSerializer;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A serialized event that hasn't yet been appended to the {@link EventStore} (as opposed to a {@link PersistedEvent}).<br>
 * Instances are created by an {@link EventSerializer}.<br>
 * Two {@link PersistableEvent}'s are <b>equal</b> if they have the same {@link #eventId()} value
 */
public class PersistableEvent {
    private final MessageId eventId;
    private final String    eventType;
    private final String    jsonData;
    private final String    jsonMetaData;

    /**
     * @param eventId      unique id of the event
     * @param eventType    the Fully Qualified Class Name of the event
     * @param jsonData     the serialized event
     * @param jsonMetaData the serialized event metadata (headers)
     */
    public PersistableEvent(MessageId eventId, String eventType, String jsonData, String jsonMetaData) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.jsonData = requireNonNull(jsonData, "No jsonData provided");
        this.jsonMetaData = requireNonNull(jsonMetaData, "No jsonMetaData provided");
    }

    public MessageId eventId() {
        return eventId;
    }

    /**
     * The Fully Qualified Class Name of the event
     */
    public String eventType() {
        return eventType;
    }

    public String jsonData() {
        return jsonData;
    }

    public String jsonMetaData() {
        return jsonMetaData;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistableEvent)) return false;
        PersistableEvent that = (PersistableEvent) o;
        return eventId.equals(that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "eventId=" + eventId +
                ", eventType='" + eventType + '\'' +
                '}';
    }
}
