package dk.cloudcreate.essentials.components.eventsourced.eventstore.inmemory;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.types.EventOrder;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Thread safe {@link EventStore} that keeps all streams in memory.<br>
 * Each stream is replaced atomically (using {@link ConcurrentHashMap#compute(Object, java.util.function.BiFunction)}),
 * which guarantees that the version check and the append happen as one step, and that readers always see a consistent stream.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentHashMap<StreamName, Stream> streams = new ConcurrentHashMap<>();
    private final Clock                                 clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock the clock used to timestamp appended events
     */
    public InMemoryEventStore(Clock clock) {
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public StreamState streamState(StreamName streamName) {
        requireNonNull(streamName, "No streamName provided");
        var stream = streams.get(streamName);
        if (stream == null) {
            return StreamState.NOT_FOUND;
        }
        return stream.deleted ? StreamState.DELETED : StreamState.EXISTS;
    }

    @Override
    public StreamEventsSlice readStreamForward(StreamName streamName, long fromEventOrder, int maxCount) {
        requireNonNull(streamName, "No streamName provided");
        requireTrue(fromEventOrder >= EventOrder.FIRST_EVENT_ORDER.longValue(), "fromEventOrder must be >= 0");
        requireTrue(maxCount > 0, "maxCount must be > 0");

        var stream = streams.get(streamName);
        if (stream == null) {
            log.trace("Stream '{}' not found", streamName);
            return StreamEventsSlice.notFound(streamName, fromEventOrder);
        }
        var version = stream.version();
        var from    = (int) Math.min(fromEventOrder, version);
        var to      = (int) Math.min((long) from + maxCount, version);
        log.trace("Reading events [{}-{}[ from stream '{}' with version {}", from, to, streamName, version);
        return StreamEventsSlice.of(streamName,
                                    stream.deleted,
                                    fromEventOrder,
                                    stream.events.subList(from, to),
                                    to >= version);
    }

    @Override
    public long appendToStream(StreamName streamName, long expectedVersion, List<PersistableEvent> events) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(events, "No events provided");

        var updatedStream = streams.compute(streamName, (name, existingStream) -> {
            var currentVersion = existingStream != null ? existingStream.version() : NO_STREAM;
            if (existingStream != null && existingStream.deleted) {
                throw new StreamDeletedException(name);
            }
            if (currentVersion != expectedVersion) {
                throw new OptimisticAppendToStreamException(name, expectedVersion, currentVersion);
            }
            if (events.isEmpty()) {
                return existingStream;
            }

            var timestamp     = OffsetDateTime.now(clock);
            var updatedEvents = new ArrayList<PersistedEvent>(existingStream != null ? existingStream.events : List.of());
            var eventOrder    = EventOrder.of(currentVersion);
            for (var event : events) {
                updatedEvents.add(new PersistedEvent(name, eventOrder, timestamp, requireNonNull(event, "events contains a null element")));
                eventOrder = eventOrder.increaseAndGet();
            }
            return new Stream(updatedEvents, false);
        });

        var newVersion = updatedStream != null ? updatedStream.version() : NO_STREAM;
        log.debug("Appended {} event(s) to stream '{}'. Stream version changed from {} to {}", events.size(), streamName, expectedVersion, newVersion);
        return newVersion;
    }

    @Override
    public void softDeleteStream(StreamName streamName, long expectedVersion) {
        requireNonNull(streamName, "No streamName provided");
        streams.compute(streamName, (name, existingStream) -> {
            if (existingStream == null) {
                throw new StreamNotFoundException(name);
            }
            if (existingStream.deleted) {
                throw new StreamDeletedException(name);
            }
            if (existingStream.version() != expectedVersion) {
                throw new OptimisticAppendToStreamException(name, expectedVersion, existingStream.version());
            }
            return new Stream(existingStream.events, true);
        });
        log.debug("Soft deleted stream '{}' at version {}", streamName, expectedVersion);
    }

    @Override
    public void hardDeleteStream(StreamName streamName, long expectedVersion) {
        requireNonNull(streamName, "No streamName provided");
        streams.compute(streamName, (name, existingStream) -> {
            if (existingStream == null) {
                throw new StreamNotFoundException(name);
            }
            if (existingStream.version() != expectedVersion) {
                throw new OptimisticAppendToStreamException(name, expectedVersion, existingStream.version());
            }
            return null;
        });
        log.debug("Hard deleted stream '{}' at version {}", streamName, expectedVersion);
    }

    @Override
    public String toString() {
        return "InMemoryEventStore{" +
                "numberOfStreams=" + streams.size() +
                '}';
    }

    private static final class Stream {
        private final List<PersistedEvent> events;
        private final boolean              deleted;

        private Stream(List<PersistedEvent> events, boolean deleted) {
            this.events = List.copyOf(events);
            this.deleted = deleted;
        }

        private long version() {
            return events.size();
        }
    }
}
