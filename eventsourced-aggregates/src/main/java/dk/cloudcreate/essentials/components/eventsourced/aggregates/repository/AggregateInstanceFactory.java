package dk.cloudcreate.essentials.components.eventsourced.aggregates.repository;

import dk.cloudcreate.essentials.components.eventsourced.aggregates.Aggregate;
import dk.cloudcreate.essentials.shared.reflection.Reflector;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Factory that helps the {@link AggregateRepository} to create an instance of a given {@link Aggregate} before it's restored from its events
 *
 * @see #defaultConstructorFactory()
 */
public interface AggregateInstanceFactory {
    /**
     * An {@link AggregateInstanceFactory} that calls the default no-arguments constructor on the concrete {@link Aggregate} type
     */
    DefaultConstructorAggregateInstanceFactory DEFAULT_CONSTRUCTOR_AGGREGATE_FACTORY = new DefaultConstructorAggregateInstanceFactory();

    /**
     * Create a new instance of <code>aggregateType</code> that has been assigned <code>aggregateId</code>
     *
     * @param aggregateId   the id of the aggregate
     * @param aggregateType the concrete aggregate type
     * @param <AGGREGATE>   the concrete aggregate type
     * @return the new aggregate instance
     */
    <AGGREGATE extends Aggregate> AGGREGATE create(UUID aggregateId, Class<AGGREGATE> aggregateType);

    /**
     * @return #DEFAULT_CONSTRUCTOR_AGGREGATE_FACTORY
     */
    static AggregateInstanceFactory defaultConstructorFactory() {
        return DEFAULT_CONSTRUCTOR_AGGREGATE_FACTORY;
    }

    /**
     * {@link AggregateInstanceFactory} that calls the default no-arguments constructor on the concrete {@link Aggregate} type
     * and then assigns the aggregate id using {@link Aggregate#initializeAggregateId(UUID)}
     */
    class DefaultConstructorAggregateInstanceFactory implements AggregateInstanceFactory {
        @Override
        public <AGGREGATE extends Aggregate> AGGREGATE create(UUID aggregateId, Class<AGGREGATE> aggregateType) {
            requireNonNull(aggregateId, "You must provide an aggregateId");
            requireNonNull(aggregateType, "You must provide an aggregateType");
            AGGREGATE aggregate = Reflector.reflectOn(aggregateType).newInstance();
            aggregate.initializeAggregateId(aggregateId);
            return aggregate;
        }
    }
}
