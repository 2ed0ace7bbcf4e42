package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import org.slf4j.*;

import java.util.*;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Routes an event to the logic that applies the event to its owner.<br>
 * Routes are keyed on the exact runtime type of the event and there can only be one route per event type.
 */
public final class EventRouter {
    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final Map<Class<?>, Consumer<Object>> routes = new HashMap<>();

    /**
     * Register the logic that must be applied when an event of type <code>eventType</code> is routed
     *
     * @param eventType the exact event type
     * @param route     the logic to invoke
     * @param <E>       the event type
     * @throws DuplicateEventRouteException in case a route has already been registered for <code>eventType</code>
     */
    public <E> void registerRoute(Class<E> eventType, Consumer<? super E> route) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(route, "No route provided");
        if (routes.containsKey(eventType)) {
            throw new DuplicateEventRouteException(eventType);
        }
        routes.put(eventType, event -> route.accept(eventType.cast(event)));
        log.trace("Registered route for event type '{}'", eventType.getName());
    }

    /**
     * Invoke the route registered for the runtime type of <code>event</code>
     *
     * @param event the event
     * @throws NoEventRouteException in case no route has been registered for the type of <code>event</code>
     */
    public void route(Object event) {
        requireNonNull(event, "No event provided");
        var route = routes.get(event.getClass());
        if (route == null) {
            throw new NoEventRouteException(event.getClass());
        }
        route.accept(event);
    }

    public boolean hasRouteFor(Class<?> eventType) {
        return routes.containsKey(eventType);
    }

    @Override
    public String toString() {
        return msg("EventRouter{routes={}}", routes.size());
    }
}
