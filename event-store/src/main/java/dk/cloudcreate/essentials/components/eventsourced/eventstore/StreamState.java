package dk.cloudcreate.essentials.components.eventsourced.eventstore;

/**
 * The state of a stream in the {@link EventStore}
 */
public enum StreamState {
    /**
     * No stream exists (it was never written to or it has been hard deleted)
     */
    NOT_FOUND,
    /**
     * The stream has been soft deleted. Its events are still readable for audit purposes
     */
    DELETED,
    EXISTS
}
