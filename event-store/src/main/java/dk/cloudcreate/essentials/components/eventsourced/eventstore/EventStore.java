package dk.cloudcreate.essentials.components.eventsourced.eventstore;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.*;

import java.util.List;

/**
 * Append-only event store where each stream contains the events of a single aggregate instance.<br>
 * The version of a stream is the number of events in it, i.e. a stream that doesn't exist yet has version
 * {@link #NO_STREAM}, and after appending the first event it has version 1.<br>
 * All write operations take an <code>expectedVersion</code> which MUST match the current version of the stream
 * (optimistic concurrency), otherwise the write fails with an {@link OptimisticAppendToStreamException} and the stream is left untouched.
 */
public interface EventStore {
    /**
     * The version of a stream that doesn't exist yet
     */
    long NO_STREAM = 0;

    /**
     * Get the state of a stream
     *
     * @param streamName the name of the stream
     * @return the state of the stream
     */
    StreamState streamState(StreamName streamName);

    /**
     * Read a slice of a stream in the order the events were appended
     *
     * @param streamName     the name of the stream
     * @param fromEventOrder the (zero based) event order of the first event to include in the slice
     * @param maxCount       the maximum number of events to include in the slice
     * @return the slice. If the stream doesn't exist {@link StreamEventsSlice#status()} is {@link StreamState#NOT_FOUND}.
     * A soft deleted stream is returned with status {@link StreamState#DELETED} together with its events
     */
    StreamEventsSlice readStreamForward(StreamName streamName, long fromEventOrder, int maxCount);

    /**
     * Append events to a stream. The stream is created if <code>expectedVersion</code> is {@link #NO_STREAM} and the stream doesn't exist
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the version the stream MUST have before the events are appended
     * @param events          the events to append
     * @return the new version of the stream
     * @throws OptimisticAppendToStreamException in case the stream's version isn't <code>expectedVersion</code>
     * @throws StreamDeletedException            in case the stream has been soft deleted
     */
    long appendToStream(StreamName streamName, long expectedVersion, List<PersistableEvent> events);

    /**
     * Soft delete a stream. The events are retained, but the stream is reported as {@link StreamState#DELETED}
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the version the stream MUST have
     * @throws OptimisticAppendToStreamException in case the stream's version isn't <code>expectedVersion</code>
     * @throws StreamNotFoundException           in case the stream doesn't exist
     * @throws StreamDeletedException            in case the stream has already been soft deleted
     */
    void softDeleteStream(StreamName streamName, long expectedVersion);

    /**
     * Irreversibly remove a stream and all its events. Afterwards the stream is reported as {@link StreamState#NOT_FOUND}
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the version the stream MUST have
     * @throws OptimisticAppendToStreamException in case the stream's version isn't <code>expectedVersion</code>
     * @throws StreamNotFoundException           in case the stream doesn't exist
     */
    void hardDeleteStream(StreamName streamName, long expectedVersion);
}
