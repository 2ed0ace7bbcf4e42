package dk.cloudcreate.essentials.components.common.correlation;

import dk.cloudcreate.essentials.components.common.types.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CorrelationEnvelopeTest {
    @Test
    void a_new_chain_uses_the_message_id_as_correlation_and_causation_id() {
        // When
        var envelope = CorrelationEnvelope.newChain();

        // Then
        assertThat((CharSequence) envelope.causationId()).isEqualTo(envelope.messageId());
        assertThat(envelope.correlationId().toString()).isEqualTo(envelope.messageId().toString());
        assertThat(envelope.isRootOfChain()).isTrue();
    }

    @Test
    void two_new_chains_have_different_ids() {
        var first  = CorrelationEnvelope.newChain();
        var second = CorrelationEnvelope.newChain();

        assertThat((CharSequence) first.messageId()).isNotEqualTo(second.messageId());
        assertThat((CharSequence) first.correlationId()).isNotEqualTo(second.correlationId());
    }

    @Test
    void a_derived_envelope_inherits_the_correlation_id_and_is_caused_by_the_source() {
        // Given
        var source = CorrelationEnvelope.newChain();

        // When
        var derived = CorrelationEnvelope.from(source);

        // Then
        assertThat((CharSequence) derived.correlationId()).isEqualTo(source.correlationId());
        assertThat((CharSequence) derived.causationId()).isEqualTo(source.messageId());
        assertThat((CharSequence) derived.messageId()).isNotEqualTo(source.messageId());
        assertThat(derived.isRootOfChain()).isFalse();
    }

    @Test
    void a_second_hop_keeps_the_original_correlation_id() {
        // Given
        var root     = CorrelationEnvelope.newChain();
        var firstHop = CorrelationEnvelope.from(root);

        // When
        var secondHop = CorrelationEnvelope.from(firstHop);

        // Then
        assertThat((CharSequence) secondHop.correlationId()).isEqualTo(root.correlationId());
        assertThat((CharSequence) secondHop.causationId()).isEqualTo(firstHop.messageId());
    }

    @Test
    void deriving_from_a_null_source_fails() {
        assertThatThrownBy(() -> CorrelationEnvelope.from(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void envelopes_with_the_same_ids_are_equal() {
        var envelope = CorrelationEnvelope.newChain();

        var copy = new CorrelationEnvelope(envelope.messageId(), envelope.correlationId(), envelope.causationId());

        assertThat(copy).isEqualTo(envelope);
        assertThat(copy.hashCode()).isEqualTo(envelope.hashCode());
        assertThat(CorrelationEnvelope.of(envelope)).isSameAs(envelope);
    }

    @Test
    void envelope_restored_from_stored_ids_keeps_its_position_in_the_chain() {
        // Given
        var root = new CorrelationEnvelope(MessageId.of("m-1"), CorrelationId.of("m-1"), MessageId.of("m-1"));

        // When
        var child = new CorrelationEnvelope(MessageId.of("m-2"), CorrelationId.of("m-1"), MessageId.of("m-1"));

        // Then
        assertThat(root.isRootOfChain()).isTrue();
        assertThat(child.isRootOfChain()).isFalse();
        assertThat((CharSequence) CorrelationEnvelope.from(root).correlationId()).isEqualTo(child.correlationId());
        assertThat((CharSequence) CorrelationEnvelope.from(root).causationId()).isEqualTo(child.causationId());
    }
}
