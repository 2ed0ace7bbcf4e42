package dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStoreException;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, RuntimeException cause) {
        super(msg, cause);
    }
}
