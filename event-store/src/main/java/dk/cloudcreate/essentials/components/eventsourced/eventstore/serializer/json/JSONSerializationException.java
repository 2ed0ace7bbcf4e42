package dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.json;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
