package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.common.correlation.CorrelatedMessage;
import dk.cloudcreate.essentials.components.eventsourced.aggregates.correlated.CorrelatedAggregateRoot;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.EventStore;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link AggregateRepository} for {@link CorrelatedAggregateRoot}'s, where every operation can be performed on behalf of a source message.<br>
 * A loaded aggregate gets the source message as its current {@link CorrelatedAggregateRoot#source()}, and saved events are stored with the
 * {@link #SOURCE_MESSAGE_ID_HEADER} and {@link #SOURCE_CORRELATION_ID_HEADER} headers.<br>
 * The source message doesn't change the optimistic concurrency rules of the {@link AggregateRepository}
 *
 * @param <AGGREGATE> the aggregate implementation type
 */
public interface CorrelatedAggregateRepository<AGGREGATE extends CorrelatedAggregateRoot> extends AggregateRepository<AGGREGATE> {
    String SOURCE_MESSAGE_ID_HEADER     = "SourceMessageId";
    String SOURCE_CORRELATION_ID_HEADER = "SourceCorrelationId";

    static <AGGREGATE extends CorrelatedAggregateRoot> CorrelatedAggregateRepository<AGGREGATE> from(EventStore eventStore,
                                                                                                  AggregateRepositoryConfiguration configuration,
                                                                                                  AggregateInstanceFactory aggregateInstanceFactory,
                                                                                                  Class<AGGREGATE> aggregateType) {
        return new DefaultCorrelatedAggregateRepository<>(eventStore, configuration, aggregateInstanceFactory, aggregateType);
    }

    static <AGGREGATE extends CorrelatedAggregateRoot> CorrelatedAggregateRepository<AGGREGATE> from(EventStore eventStore,
                                                                                                  Class<AGGREGATE> aggregateType) {
        return from(eventStore,
                    AggregateRepositoryConfiguration.defaultConfiguration(),
                    AggregateInstanceFactory.defaultConstructorFactory(),
                    aggregateType);
    }

    /**
     * {@link #getById(UUID)} on behalf of <code>source</code>
     */
    AGGREGATE getById(UUID aggregateId, CorrelatedMessage source);

    /**
     * {@link #getById(UUID, long)} on behalf of <code>source</code>
     */
    AGGREGATE getById(UUID aggregateId, long version, CorrelatedMessage source);

    default Optional<AGGREGATE> tryGetById(UUID aggregateId, CorrelatedMessage source) {
        try {
            return Optional.of(getById(aggregateId, source));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    default Optional<AGGREGATE> tryGetById(UUID aggregateId, long version, CorrelatedMessage source) {
        try {
            return Optional.of(getById(aggregateId, version, source));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * {@link #save(dk.cloudcreate.essentials.components.eventsourced.aggregates.Aggregate)} on behalf of <code>source</code>
     */
    void save(AGGREGATE aggregate, CorrelatedMessage source);

    void delete(AGGREGATE aggregate, CorrelatedMessage source);

    void hardDelete(AGGREGATE aggregate, CorrelatedMessage source);

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultCorrelatedAggregateRepository<AGGREGATE extends CorrelatedAggregateRoot> extends DefaultAggregateRepository<AGGREGATE> implements CorrelatedAggregateRepository<AGGREGATE> {
        private static final Logger log = LoggerFactory.getLogger(CorrelatedAggregateRepository.class);

        public DefaultCorrelatedAggregateRepository(EventStore eventStore,
                                                    AggregateRepositoryConfiguration configuration,
                                                    AggregateInstanceFactory aggregateInstanceFactory,
                                                    Class<AGGREGATE> aggregateType) {
            super(eventStore, configuration, aggregateInstanceFactory, aggregateType);
        }

        @Override
        public AGGREGATE getById(UUID aggregateId, CorrelatedMessage source) {
            requireNonNull(source, "You must supply a source");
            var aggregate = getById(aggregateId);
            aggregate.source(source);
            logOperation("Loaded", aggregate, source);
            return aggregate;
        }

        @Override
        public AGGREGATE getById(UUID aggregateId, long version, CorrelatedMessage source) {
            requireNonNull(source, "You must supply a source");
            var aggregate = getById(aggregateId, version);
            aggregate.source(source);
            logOperation("Loaded", aggregate, source);
            return aggregate;
        }

        @Override
        public void save(AGGREGATE aggregate, CorrelatedMessage source) {
            requireNonNull(aggregate, "You must supply an aggregate");
            requireNonNull(source, "You must supply a source");
            logOperation("Saving", aggregate, source);
            save(aggregate, commitHeaders -> {
                commitHeaders.put(SOURCE_MESSAGE_ID_HEADER, source.messageId().toString());
                commitHeaders.put(SOURCE_CORRELATION_ID_HEADER, source.correlationId().toString());
            });
        }

        @Override
        public void delete(AGGREGATE aggregate, CorrelatedMessage source) {
            requireNonNull(aggregate, "You must supply an aggregate");
            requireNonNull(source, "You must supply a source");
            logOperation("Deleting", aggregate, source);
            delete(aggregate);
        }

        @Override
        public void hardDelete(AGGREGATE aggregate, CorrelatedMessage source) {
            requireNonNull(aggregate, "You must supply an aggregate");
            requireNonNull(source, "You must supply a source");
            logOperation("Hard deleting", aggregate, source);
            hardDelete(aggregate);
        }

        private void logOperation(String operation, AGGREGATE aggregate, CorrelatedMessage source) {
            log.debug("{} '{}' with id '{}' at version {} on behalf of message '{}' with correlation id '{}'",
                      operation,
                      aggregateType().getName(),
                      aggregate.aggregateId(),
                      aggregate.version(),
                      source.messageId(),
                      source.correlationId());
        }
    }
}
