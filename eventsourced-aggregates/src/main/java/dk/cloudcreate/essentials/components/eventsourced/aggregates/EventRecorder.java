package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Records events that have been applied to an aggregate but haven't been persisted yet.<br>
 * Events are kept in the order they were recorded.
 */
public final class EventRecorder {
    private List<Object> recordedEvents = new ArrayList<>();

    public void record(Object event) {
        recordedEvents.add(requireNonNull(event, "No event provided"));
    }

    public boolean hasRecordedEvents() {
        return !recordedEvents.isEmpty();
    }

    /**
     * Snapshot of the recorded events. The recorder isn't changed
     */
    public List<Object> recordedEvents() {
        return List.copyOf(recordedEvents);
    }

    /**
     * Discard all recorded events
     */
    public void reset() {
        recordedEvents = new ArrayList<>();
    }

    /**
     * Hand over the recorded events and leave the recorder empty
     *
     * @return the recorded events in the order they were recorded
     */
    public List<Object> drain() {
        var drained = recordedEvents;
        recordedEvents = new ArrayList<>();
        return Collections.unmodifiableList(drained);
    }

    @Override
    public String toString() {
        return "EventRecorder{" +
                "recordedEvents=" + recordedEvents.size() +
                '}';
    }
}
