package dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.json;

import dk.cloudcreate.essentials.components.common.correlation.*;
import dk.cloudcreate.essentials.components.common.types.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.eventstream.StreamName;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.EventSerializer;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.types.EventOrder;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.*;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JacksonEventSerializerTest {
    private static final StreamName STREAM_NAME = StreamName.of("account-1");

    private final JacksonEventSerializer serializer = JacksonEventSerializer.standardSerializer();

    @Test
    void serialized_event_carries_its_type_name_and_headers() {
        // Given
        var event = new AmountDeposited(new BigDecimal("100.50"));

        // When
        var persistable = serializer.serialize(event, Map.of("CommitId", "commit-1"));

        // Then
        assertThat(persistable.eventType()).isEqualTo(AmountDeposited.class.getName());
        assertThat((CharSequence) persistable.eventId()).isNotNull();
        var metaData = serializer.deserializeMetaData(persisted(persistable));
        assertThat(metaData).containsEntry("CommitId", "commit-1")
                            .containsEntry(EventSerializer.EVENT_CLR_TYPE_HEADER, AmountDeposited.class.getName())
                            .doesNotContainKey(EventSerializer.CORRELATION_ID_HEADER);
    }

    @Test
    void deserializes_event_into_its_original_type() {
        // Given
        var event       = new AmountDeposited(new BigDecimal("100.50"));
        var persistable = serializer.serialize(event, Map.of());

        // When
        var deserialized = serializer.deserialize(persisted(persistable));

        // Then
        assertThat(deserialized).isInstanceOf(AmountDeposited.class);
        assertThat(((AmountDeposited) deserialized).amount).isEqualByComparingTo("100.50");
    }

    @Test
    void correlated_event_keeps_message_id_as_event_id_and_exposes_correlation_headers() {
        // Given
        var source = CorrelationEnvelope.newChain();
        var event  = MessageBuilder.from(source, envelope -> new AccountOpened(envelope, "Jane"));

        // When
        var persistable = serializer.serialize(event, Map.of());

        // Then
        assertThat((CharSequence) persistable.eventId()).isEqualTo(event.messageId());
        var metaData = serializer.deserializeMetaData(persisted(persistable));
        assertThat(metaData).containsEntry(EventSerializer.MESSAGE_ID_HEADER, event.messageId().toString())
                            .containsEntry(EventSerializer.CORRELATION_ID_HEADER, source.correlationId().toString())
                            .containsEntry(EventSerializer.CAUSATION_ID_HEADER, source.messageId().toString());

        var deserialized = (AccountOpened) serializer.deserialize(persisted(persistable));
        assertThat(deserialized.owner).isEqualTo("Jane");
        assertThat((CharSequence) deserialized.messageId()).isEqualTo(event.messageId());
        assertThat((CharSequence) deserialized.correlationId()).isEqualTo(source.correlationId());
        assertThat((CharSequence) deserialized.causationId()).isEqualTo(source.messageId());
    }

    @Test
    void unknown_event_type_fails_deserialization() {
        var persistable = new PersistableEvent(MessageId.random(), "com.example.DoesNotExist", "{}", "{}");

        assertThatThrownBy(() -> serializer.deserialize(persisted(persistable)))
                .isInstanceOf(JSONDeserializationException.class)
                .hasMessageContaining("com.example.DoesNotExist");
    }

    @Test
    void malformed_json_fails_deserialization() {
        var persistable = new PersistableEvent(MessageId.random(), AmountDeposited.class.getName(), "{not-json", "{}");

        assertThatThrownBy(() -> serializer.deserialize(persisted(persistable)))
                .isInstanceOf(JSONDeserializationException.class);
    }

    private static PersistedEvent persisted(PersistableEvent persistable) {
        return new PersistedEvent(STREAM_NAME, EventOrder.FIRST_EVENT_ORDER, OffsetDateTime.now(ZoneOffset.UTC), persistable);
    }

    public static class AmountDeposited {
        private BigDecimal amount;

        public AmountDeposited() {
        }

        public AmountDeposited(BigDecimal amount) {
            this.amount = amount;
        }
    }

    public static class AccountOpened implements CorrelatedMessage {
        private MessageId     messageId;
        private CorrelationId correlationId;
        private MessageId     causationId;
        private String        owner;

        public AccountOpened() {
        }

        public AccountOpened(CorrelationEnvelope envelope, String owner) {
            this.messageId = envelope.messageId();
            this.correlationId = envelope.correlationId();
            this.causationId = envelope.causationId();
            this.owner = owner;
        }

        @Override
        public MessageId messageId() {
            return messageId;
        }

        @Override
        public CorrelationId correlationId() {
            return correlationId;
        }

        @Override
        public MessageId causationId() {
            return causationId;
        }
    }
}
