package dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.json.*;

import java.util.Map;

/**
 * Converts events to and from the representation stored in the event store
 *
 * @see JacksonEventSerializer
 */
public interface EventSerializer {
    /**
     * Header containing the Fully Qualified Class Name of the event
     */
    String EVENT_CLR_TYPE_HEADER = "EventClrTypeName";
    String MESSAGE_ID_HEADER     = "MessageId";
    String CORRELATION_ID_HEADER = "CorrelationId";
    String CAUSATION_ID_HEADER   = "CausationId";

    /**
     * Serialize an event together with its headers
     *
     * @param event   the event
     * @param headers headers that will be stored as the event's metadata
     * @return the serialized event
     * @throws JSONSerializationException in case the event couldn't be serialized
     */
    PersistableEvent serialize(Object event, Map<String, Object> headers);

    /**
     * Deserialize a persisted event back into the event type it was serialized from
     *
     * @param persistedEvent the persisted event
     * @return the deserialized event
     * @throws JSONDeserializationException in case the event couldn't be deserialized
     */
    Object deserialize(PersistedEvent persistedEvent);

    /**
     * Deserialize the headers stored together with an event
     *
     * @param persistedEvent the persisted event
     * @return the headers
     * @throws JSONDeserializationException in case the metadata couldn't be deserialized
     */
    Map<String, Object> deserializeMetaData(PersistedEvent persistedEvent);
}
