package dk.cloudcreate.essentials.components.eventsourced.aggregates;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EventRecorderTest {
    @Test
    void new_recorder_has_no_recorded_events() {
        var recorder = new EventRecorder();

        assertThat(recorder.hasRecordedEvents()).isFalse();
        assertThat(recorder.recordedEvents()).isEmpty();
    }

    @Test
    void recorded_events_are_kept_in_the_order_they_were_recorded() {
        // Given
        var recorder = new EventRecorder();

        // When
        recorder.record("first");
        recorder.record("second");
        recorder.record("third");

        // Then
        assertThat(recorder.hasRecordedEvents()).isTrue();
        assertThat(recorder.recordedEvents()).containsExactly("first", "second", "third");
    }

    @Test
    void recorded_events_is_a_snapshot() {
        // Given
        var recorder = new EventRecorder();
        recorder.record("first");
        var snapshot = recorder.recordedEvents();

        // When
        recorder.record("second");

        // Then
        assertThat(snapshot).containsExactly("first");
        assertThatThrownBy(() -> snapshot.add("third")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(recorder.recordedEvents()).containsExactly("first", "second");
    }

    @Test
    void reset_discards_recorded_events() {
        var recorder = new EventRecorder();
        recorder.record("first");

        recorder.reset();

        assertThat(recorder.hasRecordedEvents()).isFalse();
        assertThat(recorder.recordedEvents()).isEmpty();
    }

    @Test
    void drain_hands_over_recorded_events_and_leaves_recorder_empty() {
        // Given
        var recorder = new EventRecorder();
        recorder.record("first");
        recorder.record("second");

        // When
        var drained = recorder.drain();
        recorder.record("third");

        // Then
        assertThat(drained).containsExactly("first", "second");
        assertThat(recorder.recordedEvents()).containsExactly("third");
        assertThat(recorder.drain()).containsExactly("third");
        assertThat(recorder.drain()).isEmpty();
    }

    @Test
    void recording_null_fails() {
        assertThatThrownBy(() -> new EventRecorder().record(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
