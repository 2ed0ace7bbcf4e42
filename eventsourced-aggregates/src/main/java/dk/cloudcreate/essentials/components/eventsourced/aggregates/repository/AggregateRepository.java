package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.eventsourced.aggregates.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.*;
import org.slf4j.*;

import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link Aggregate} Repository that loads and saves a specific {@link Aggregate} type using an {@link EventStore}.<br>
 * Saving is protected by optimistic concurrency: the events taken from the aggregate are only appended if the aggregate's stream still has the
 * length (version) the aggregate had before its events were taken. There is no automatic merge or retry, a caller that gets an
 * {@link OptimisticAggregateSaveException} must load the aggregate again and retry the business operation.
 * <p>
 * You can use {@link #from(EventStore, AggregateRepositoryConfiguration, AggregateInstanceFactory, Class)} to create a new {@link AggregateRepository}
 * instance. Alternatively you can extend from the {@link DefaultAggregateRepository} and add your own special methods
 *
 * @param <AGGREGATE> the aggregate implementation type
 * @see DefaultAggregateRepository
 */
public interface AggregateRepository<AGGREGATE extends Aggregate> {
    /**
     * Header containing the id of the save operation. All events saved together share the same commit id
     */
    String COMMIT_ID_HEADER          = "CommitId";
    /**
     * Header containing the Fully Qualified Class Name of the aggregate
     */
    String AGGREGATE_CLR_TYPE_HEADER = "AggregateClrTypeName";

    /**
     * Create an {@link AggregateRepository} instance that supports loading and saving the given Aggregate type
     *
     * @param eventStore               the {@link EventStore} instance to use
     * @param configuration            the repository configuration
     * @param aggregateInstanceFactory the factory responsible for instantiating your aggregates when loading them from the {@link EventStore}
     * @param aggregateType            the concrete aggregate type
     * @param <AGGREGATE>              the concrete aggregate type
     * @return a repository instance that can be used to load, save and delete aggregates of type <code>aggregateType</code>
     */
    static <AGGREGATE extends Aggregate> AggregateRepository<AGGREGATE> from(EventStore eventStore,
                                                                          AggregateRepositoryConfiguration configuration,
                                                                          AggregateInstanceFactory aggregateInstanceFactory,
                                                                          Class<AGGREGATE> aggregateType) {
        return new DefaultAggregateRepository<>(eventStore, configuration, aggregateInstanceFactory, aggregateType);
    }

    /**
     * Create an {@link AggregateRepository} instance using {@link AggregateRepositoryConfiguration#defaultConfiguration()} and
     * {@link AggregateInstanceFactory#defaultConstructorFactory()}
     */
    static <AGGREGATE extends Aggregate> AggregateRepository<AGGREGATE> from(EventStore eventStore,
                                                                          Class<AGGREGATE> aggregateType) {
        return from(eventStore,
                    AggregateRepositoryConfiguration.defaultConfiguration(),
                    AggregateInstanceFactory.defaultConstructorFactory(),
                    aggregateType);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Load the aggregate by replaying all the events in its stream
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate
     * @throws AggregateNotFoundException in case the aggregate's stream doesn't exist
     * @throws AggregateDeletedException  in case the aggregate's stream has been soft deleted
     */
    AGGREGATE getById(UUID aggregateId);

    /**
     * Load the aggregate by replaying the first <code>version</code> events in its stream
     *
     * @param aggregateId the id of the aggregate
     * @param version     the number of events to replay. Must be &gt; 0
     * @return the aggregate at <code>version</code>
     * @throws AggregateNotFoundException in case the aggregate's stream doesn't exist
     * @throws AggregateDeletedException  in case the aggregate's stream has been soft deleted
     * @throws AggregateVersionException  in case the stream contains fewer than <code>version</code> events
     */
    AGGREGATE getById(UUID aggregateId, long version);

    /**
     * Same as {@link #getById(UUID)}, except that a missing aggregate results in an {@link Optional#empty()}<br>
     * A deleted aggregate still results in an {@link AggregateDeletedException}
     */
    default Optional<AGGREGATE> tryGetById(UUID aggregateId) {
        try {
            return Optional.of(getById(aggregateId));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Same as {@link #getById(UUID, long)}, except that a missing aggregate results in an {@link Optional#empty()}<br>
     * A deleted aggregate or a version that isn't available still results in an exception
     */
    default Optional<AGGREGATE> tryGetById(UUID aggregateId, long version) {
        try {
            return Optional.of(getById(aggregateId, version));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Take the recorded events from the aggregate and append them to the aggregate's stream
     *
     * @param aggregate the aggregate
     * @throws OptimisticAggregateSaveException in case the stream has been changed since the aggregate was loaded
     * @throws AggregateDeletedException        in case the aggregate's stream has been soft deleted
     */
    default void save(AGGREGATE aggregate) {
        save(aggregate, commitHeaders -> {
        });
    }

    /**
     * Take the recorded events from the aggregate and append them to the aggregate's stream
     *
     * @param aggregate           the aggregate
     * @param updateCommitHeaders callback that can add headers that will be stored with every event saved
     * @throws OptimisticAggregateSaveException in case the stream has been changed since the aggregate was loaded
     * @throws AggregateDeletedException        in case the aggregate's stream has been soft deleted
     */
    void save(AGGREGATE aggregate, Consumer<Map<String, Object>> updateCommitHeaders);

    /**
     * Soft delete the aggregate's stream. The events are retained but the aggregate can no longer be loaded
     *
     * @param aggregate the aggregate, which must not have any recorded events
     * @throws AggregateHasRecordedEventsException in case the aggregate has recorded events
     * @throws OptimisticAggregateSaveException    in case the stream has been changed since the aggregate was loaded
     * @throws AggregateNotFoundException          in case the aggregate's stream doesn't exist
     * @throws AggregateDeletedException           in case the aggregate's stream has already been soft deleted
     */
    void delete(AGGREGATE aggregate);

    /**
     * Irreversibly remove the aggregate's stream and all its events
     *
     * @param aggregate the aggregate, which must not have any recorded events
     * @throws AggregateHasRecordedEventsException in case the aggregate has recorded events
     * @throws OptimisticAggregateSaveException    in case the stream has been changed since the aggregate was loaded
     * @throws AggregateNotFoundException          in case the aggregate's stream doesn't exist
     */
    void hardDelete(AGGREGATE aggregate);

    /**
     * The type of {@link Aggregate} implementation this repository handles
     */
    Class<AGGREGATE> aggregateType();

    /**
     * The name of the stream that contains the events of the aggregate with id <code>aggregateId</code>
     */
    StreamName streamNameFor(UUID aggregateId);

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Default {@link AggregateRepository} implementation. You can extend this class directly if you need to expand the supported methods or
     * use {@link AggregateRepository#from(EventStore, AggregateRepositoryConfiguration, AggregateInstanceFactory, Class)} to create a default instance
     *
     * @param <AGGREGATE> the concrete aggregate type
     */
    class DefaultAggregateRepository<AGGREGATE extends Aggregate> implements AggregateRepository<AGGREGATE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

        private final EventStore                       eventStore;
        private final AggregateRepositoryConfiguration configuration;
        private final AggregateInstanceFactory         aggregateInstanceFactory;
        private final Class<AGGREGATE>                 aggregateType;

        public DefaultAggregateRepository(EventStore eventStore,
                                          AggregateRepositoryConfiguration configuration,
                                          AggregateInstanceFactory aggregateInstanceFactory,
                                          Class<AGGREGATE> aggregateType) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.configuration = requireNonNull(configuration, "You must supply an AggregateRepositoryConfiguration");
            this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "You must supply an AggregateInstanceFactory");
            this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
        }

        @Override
        public AGGREGATE getById(UUID aggregateId) {
            return load(aggregateId, Long.MAX_VALUE, false);
        }

        @Override
        public AGGREGATE getById(UUID aggregateId, long version) {
            requireTrue(version > 0, msg("Cannot get version {} of '{}'. The version must be > 0", version, aggregateType.getName()));
            return load(aggregateId, version, true);
        }

        private AGGREGATE load(UUID aggregateId, long version, boolean versionBounded) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            var streamName = streamNameFor(aggregateId);
            var aggregate  = aggregateInstanceFactory.create(aggregateId, aggregateType);
            log.trace("Loading '{}' with id '{}' from stream '{}'", aggregateType.getName(), aggregateId, streamName);

            long              sliceStart        = 0;
            long              appliedEventCount = 0;
            StreamEventsSlice slice;
            do {
                var sliceCount = (int) Math.min(configuration.readPageSize, version - sliceStart);
                slice = eventStore.readStreamForward(streamName, sliceStart, sliceCount);
                if (slice.status() == StreamState.NOT_FOUND) {
                    throw new AggregateNotFoundException(aggregateId, aggregateType);
                }
                if (slice.status() == StreamState.DELETED) {
                    throw new AggregateDeletedException(aggregateId, aggregateType);
                }
                aggregate.restoreFromEvents(slice.events()
                                                 .stream()
                                                 .map(configuration.eventSerializer::deserialize)
                                                 .collect(Collectors.toList()));
                appliedEventCount += slice.events().size();
                sliceStart = slice.nextEventOrder();
            } while (sliceStart < version && !slice.isEndOfStream());

            if (versionBounded && appliedEventCount != version) {
                throw new AggregateVersionException(aggregateId, aggregateType, version, appliedEventCount);
            }
            log.debug("Loaded '{}' with id '{}' at version {}", aggregateType.getName(), aggregateId, aggregate.version());
            return aggregate;
        }

        @Override
        public void save(AGGREGATE aggregate, Consumer<Map<String, Object>> updateCommitHeaders) {
            requireNonNull(aggregate, "You must supply an aggregate");
            requireNonNull(updateCommitHeaders, "You must supply an updateCommitHeaders callback");
            var aggregateId     = aggregate.aggregateId();
            var streamName      = streamNameFor(aggregateId);
            var expectedVersion = aggregate.version();
            var events          = aggregate.takeEvents();
            if (events.isEmpty()) {
                log.trace("No events to save for '{}' with id '{}'", aggregateType.getName(), aggregateId);
                return;
            }

            var commitHeaders = new LinkedHashMap<String, Object>();
            commitHeaders.put(COMMIT_ID_HEADER, UUID.randomUUID().toString());
            commitHeaders.put(AGGREGATE_CLR_TYPE_HEADER, aggregate.getClass().getName());
            updateCommitHeaders.accept(commitHeaders);

            var eventsToPersist = events.stream()
                                        .map(event -> configuration.eventSerializer.serialize(event, new LinkedHashMap<>(commitHeaders)))
                                        .collect(Collectors.toList());
            try {
                var newVersion = eventStore.appendToStream(streamName, expectedVersion, eventsToPersist);
                log.debug("Saved {} event(s) for '{}' with id '{}'. Stream '{}' is now at version {}",
                          eventsToPersist.size(),
                          aggregateType.getName(),
                          aggregateId,
                          streamName,
                          newVersion);
            } catch (OptimisticAppendToStreamException e) {
                throw new OptimisticAggregateSaveException(aggregateId, aggregateType, e);
            } catch (StreamDeletedException e) {
                throw new AggregateDeletedException(aggregateId, aggregateType, e);
            }
        }

        @Override
        public void delete(AGGREGATE aggregate) {
            requireNonNull(aggregate, "You must supply an aggregate");
            requireNoRecordedEvents(aggregate, "delete");
            var aggregateId = aggregate.aggregateId();
            try {
                eventStore.softDeleteStream(streamNameFor(aggregateId), aggregate.version());
                log.debug("Deleted '{}' with id '{}' at version {}", aggregateType.getName(), aggregateId, aggregate.version());
            } catch (OptimisticAppendToStreamException e) {
                throw new OptimisticAggregateSaveException(aggregateId, aggregateType, e);
            } catch (StreamNotFoundException e) {
                throw new AggregateNotFoundException(aggregateId, aggregateType, e);
            } catch (StreamDeletedException e) {
                throw new AggregateDeletedException(aggregateId, aggregateType, e);
            }
        }

        @Override
        public void hardDelete(AGGREGATE aggregate) {
            requireNonNull(aggregate, "You must supply an aggregate");
            requireNoRecordedEvents(aggregate, "hard delete");
            var aggregateId = aggregate.aggregateId();
            try {
                eventStore.hardDeleteStream(streamNameFor(aggregateId), aggregate.version());
                log.debug("Hard deleted '{}' with id '{}' at version {}", aggregateType.getName(), aggregateId, aggregate.version());
            } catch (OptimisticAppendToStreamException e) {
                throw new OptimisticAggregateSaveException(aggregateId, aggregateType, e);
            } catch (StreamNotFoundException e) {
                throw new AggregateNotFoundException(aggregateId, aggregateType, e);
            }
        }

        private void requireNoRecordedEvents(AGGREGATE aggregate, String operation) {
            if (aggregate.hasRecordedEvents()) {
                throw new AggregateHasRecordedEventsException(msg("Cannot {} '{}' with id '{}' as it has recorded events that haven't been saved",
                                                                  operation,
                                                                  aggregateType.getName(),
                                                                  aggregate.aggregateId()));
            }
        }

        @Override
        public Class<AGGREGATE> aggregateType() {
            return aggregateType;
        }

        @Override
        public StreamName streamNameFor(UUID aggregateId) {
            return configuration.streamNameBuilder.generateForAggregate(aggregateType, aggregateId);
        }

        @Override
        public String toString() {
            return "AggregateRepository{" +
                    "aggregateType=" + aggregateType.getName() +
                    ", configuration=" + configuration +
                    '}';
        }
    }
}
