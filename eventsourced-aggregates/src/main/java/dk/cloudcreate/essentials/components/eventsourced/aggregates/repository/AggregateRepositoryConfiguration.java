package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.EventSerializer;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.json.JacksonEventSerializer;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Configuration of how an {@link AggregateRepository} names, serializes and reads the streams of its aggregates
 */
public final class AggregateRepositoryConfiguration {
    public static final int DEFAULT_READ_PAGE_SIZE = 500;

    /**
     * Generates the name of the stream for each aggregate instance
     */
    public final StreamNameBuilder streamNameBuilder;
    public final EventSerializer   eventSerializer;
    /**
     * The maximum number of events read from the event store per request when an aggregate is loaded
     */
    public final int               readPageSize;

    public AggregateRepositoryConfiguration(StreamNameBuilder streamNameBuilder,
                                            EventSerializer eventSerializer,
                                            int readPageSize) {
        this.streamNameBuilder = requireNonNull(streamNameBuilder, "No streamNameBuilder provided");
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        requireTrue(readPageSize > 0, "readPageSize must be > 0");
        this.readPageSize = readPageSize;
    }

    /**
     * Configuration using the {@link PrefixedCamelCaseStreamNameBuilder} without prefix, {@link JacksonEventSerializer#standardSerializer()}
     * and a read page size of {@link #DEFAULT_READ_PAGE_SIZE}
     */
    public static AggregateRepositoryConfiguration defaultConfiguration() {
        return defaultConfiguration(JacksonEventSerializer.standardSerializer());
    }

    public static AggregateRepositoryConfiguration defaultConfiguration(EventSerializer eventSerializer) {
        return new AggregateRepositoryConfiguration(new PrefixedCamelCaseStreamNameBuilder(),
                                                    eventSerializer,
                                                    DEFAULT_READ_PAGE_SIZE);
    }

    public AggregateRepositoryConfiguration withStreamNameBuilder(StreamNameBuilder streamNameBuilder) {
        return new AggregateRepositoryConfiguration(streamNameBuilder, eventSerializer, readPageSize);
    }

    public AggregateRepositoryConfiguration withReadPageSize(int readPageSize) {
        return new AggregateRepositoryConfiguration(streamNameBuilder, eventSerializer, readPageSize);
    }

    @Override
    public String toString() {
        return "AggregateRepositoryConfiguration{" +
                "streamNameBuilder=" + streamNameBuilder +
                ", eventSerializer=" + eventSerializer.getClass().getSimpleName() +
                ", readPageSize=" + readPageSize +
                '}';
    }
}
