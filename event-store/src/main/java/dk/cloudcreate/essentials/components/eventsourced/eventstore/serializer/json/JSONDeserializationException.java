package dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.json;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
