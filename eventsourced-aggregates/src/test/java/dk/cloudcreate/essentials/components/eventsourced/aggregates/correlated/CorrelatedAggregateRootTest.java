package dk.cloudcreate.essentials.components.eventsourced.aggregates.correlated;

import dk.cloudcreate.essentials.components.common.correlation.*;
import dk.cloudcreate.essentials.components.eventsourced.aggregates.*;
import dk.cloudcreate.essentials.components.eventsourced.aggregates.test_data.Transfer;
import dk.cloudcreate.essentials.components.eventsourced.aggregates.test_data.TransferCommands.*;
import dk.cloudcreate.essentials.components.eventsourced.aggregates.test_data.TransferEvents.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class CorrelatedAggregateRootTest {
    private static final UUID TRANSFER_ID = UUID.fromString("a3f0c8de-6a35-4b9b-8a41-1c1b0c2e7f10");

    @Test
    void raised_event_is_caused_by_the_source() {
        // Given
        var command = MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN));

        // When
        var transfer = new Transfer(command);

        // Then
        var events = transfer.takeEvents();
        assertThat(events).hasSize(1);
        var event = (TransferRequested) events.get(0);
        assertThat((CharSequence) event.correlationId()).isEqualTo(command.correlationId());
        assertThat((CharSequence) event.causationId()).isEqualTo(command.messageId());
        assertThat((CharSequence) event.messageId()).isNotEqualTo(command.messageId());
        assertThat(event.isCausedBy(command)).isTrue();
        assertThat(transfer.aggregateId()).isEqualTo(TRANSFER_ID);
    }

    @Test
    void correlation_id_is_preserved_through_a_second_hop() {
        // Given
        var request  = MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN));
        var transfer = new Transfer(request);
        var requested = (TransferRequested) transfer.takeEvents().get(0);
        var complete = MessageBuilder.from(requested, envelope -> new CompleteTransfer(envelope, TRANSFER_ID));

        // When
        transfer.complete(complete);

        // Then
        var completed = (TransferCompleted) transfer.takeEvents().get(0);
        assertThat((CharSequence) completed.correlationId()).isEqualTo(request.correlationId());
        assertThat((CharSequence) completed.causationId()).isEqualTo(complete.messageId());
        assertThat(transfer.isCompleted()).isTrue();
        assertThat(transfer.version()).isEqualTo(2);
    }

    @Test
    void source_is_cleared_after_taking_events() {
        // Given
        var transfer = new Transfer(MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN)));
        assertThat(transfer.source()).isPresent();

        // When
        transfer.takeEvents();

        // Then
        assertThat(transfer.source()).isEmpty();
    }

    @Test
    void raising_without_a_source_fails() {
        // Given
        var transfer = new Transfer();
        transfer.restoreFromEvents(List.of(new TransferRequested(TRANSFER_ID, BigDecimal.TEN)));

        // When
        var thrown = catchThrowable(transfer::completeUsingCurrentSource);

        // Then
        assertThat(thrown).isInstanceOf(CorrelationException.class)
                          .hasMessageContaining("without a source");
        assertThat(transfer.hasRecordedEvents()).isFalse();
    }

    @Test
    void raising_an_uncorrelated_event_fails() {
        // Given
        var transfer = new Transfer(MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN)));

        // When
        var thrown = catchThrowable(() -> transfer.increaseAmount(BigDecimal.ONE));

        // Then
        assertThat(thrown).isInstanceOf(CorrelationException.class)
                          .hasMessageContaining("uncorrelated");
        assertThat(transfer.amount()).isEqualByComparingTo("10");
    }

    @Test
    void raising_an_event_from_a_different_chain_fails() {
        // Given
        var transfer = new Transfer(MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN)));

        // When
        var thrown = catchThrowable(() -> transfer.completeUsingEnvelope(CorrelationEnvelope.newChain()));

        // Then
        assertThat(thrown).isInstanceOf(CorrelationException.class);
        assertThat(transfer.isCompleted()).isFalse();
    }

    @Test
    void source_cannot_change_while_events_are_recorded_under_another_source() {
        // Given
        var transfer = new Transfer(MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN)));
        var other    = MessageBuilder.newMessage(envelope -> new CompleteTransfer(envelope, TRANSFER_ID));

        // Then
        assertThatThrownBy(() -> transfer.source(other)).isInstanceOf(CorrelationException.class);

        transfer.takeEvents();
        transfer.source(other);
        assertThat(transfer.source()).containsSame(other);
    }

    @Test
    void events_caused_by_different_sources_can_be_raised_before_they_are_taken() {
        // Given
        var request  = MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN));
        var complete = MessageBuilder.newMessage(envelope -> new CompleteTransfer(envelope, TRANSFER_ID));
        var transfer = new Transfer(request);

        // When
        transfer.complete(complete);

        // Then
        assertThat(transfer.source()).containsSame(request);
        var events = transfer.takeEvents();
        assertThat(events).hasSize(2);
        var requested = (TransferRequested) events.get(0);
        assertThat((CharSequence) requested.correlationId()).isEqualTo(request.correlationId());
        assertThat((CharSequence) requested.causationId()).isEqualTo(request.messageId());
        var completed = (TransferCompleted) events.get(1);
        assertThat((CharSequence) completed.correlationId()).isEqualTo(complete.correlationId());
        assertThat((CharSequence) completed.causationId()).isEqualTo(complete.messageId());
        assertThat(transfer.isCompleted()).isTrue();
        assertThat(transfer.version()).isEqualTo(2);
    }

    @Test
    void raising_on_behalf_of_a_source_correlates_an_unstamped_event_with_that_source() {
        // Given
        var transfer = new Transfer();
        transfer.restoreFromEvents(List.of(new TransferRequested(TRANSFER_ID, BigDecimal.TEN)));
        var complete = MessageBuilder.newMessage(envelope -> new CompleteTransfer(envelope, TRANSFER_ID));
        var event    = new TransferCompleted();

        // When
        transfer.raiseOnBehalfOf(event, complete);

        // Then
        assertThat(event.isCausedBy(complete)).isTrue();
        assertThat((CharSequence) event.messageId()).isNotEqualTo(complete.messageId());
        assertThat(transfer.source()).isEmpty();
        assertThat(transfer.isCompleted()).isTrue();
    }

    @Test
    void raising_an_event_without_a_route_leaves_the_event_and_the_source_untouched() {
        // Given
        var request  = MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN));
        var cancel   = MessageBuilder.newMessage(envelope -> new CompleteTransfer(envelope, TRANSFER_ID));
        var transfer = new Transfer(request);
        var event    = new TransferCancelled();

        // When
        var thrown = catchThrowable(() -> transfer.raiseOnBehalfOf(event, cancel));

        // Then
        assertThat(thrown).isInstanceOf(NoEventRouteException.class);
        assertThat(event.isCorrelated()).isFalse();
        assertThat(transfer.source()).containsSame(request);
        assertThat(transfer.takeEvents()).hasSize(1);
    }

    @Test
    void update_with_events_fails_without_changes_while_events_are_recorded() {
        // Given
        var transfer = new Transfer(MessageBuilder.newMessage(envelope -> new RequestTransfer(envelope, TRANSFER_ID, BigDecimal.TEN)));
        transfer.takeEvents();
        var first = MessageBuilder.newMessage(envelope -> new CompleteTransfer(envelope, TRANSFER_ID));
        transfer.source(first);
        transfer.completeUsingCurrentSource();
        var second = MessageBuilder.newMessage(envelope -> new CompleteTransfer(envelope, TRANSFER_ID));

        // When
        var thrown = catchThrowable(() -> transfer.updateWithEvents(List.of(new TransferCompleted(CorrelationEnvelope.newChain())), 1, second));

        // Then
        assertThat(thrown).isInstanceOf(AggregateHasRecordedEventsException.class);
        assertThat(transfer.version()).isEqualTo(1);
        assertThat(transfer.source()).containsSame(first);
        assertThat(transfer.takeEvents()).hasSize(1);
    }

    @Test
    void update_with_events_checks_the_version_and_sets_the_source() {
        // Given
        var transfer = new Transfer();
        transfer.restoreFromEvents(List.of(new TransferRequested(TRANSFER_ID, BigDecimal.TEN)));
        var complete = MessageBuilder.newMessage(envelope -> new CompleteTransfer(envelope, TRANSFER_ID));

        // When
        transfer.updateWithEvents(List.of(new TransferCompleted(CorrelationEnvelope.newChain())), 1, complete);

        // Then
        assertThat(transfer.version()).isEqualTo(2);
        assertThat(transfer.isCompleted()).isTrue();
        assertThat(transfer.source()).containsSame(complete);
        assertThatThrownBy(() -> transfer.updateWithEvents(List.of(), 1, complete))
                .isInstanceOf(AggregateVersionConflictException.class);
    }

    @Test
    void an_event_can_only_be_correlated_once() {
        var event = new TransferCompleted(CorrelationEnvelope.newChain());

        assertThatThrownBy(() -> event.correlateWith(CorrelationEnvelope.newChain()))
                .isInstanceOf(CorrelationException.class);
    }
}
