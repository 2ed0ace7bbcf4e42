package dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.json;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dk.cloudcreate.essentials.components.common.correlation.CorrelatedMessage;
import dk.cloudcreate.essentials.components.common.types.MessageId;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.persistence.*;
import dk.cloudcreate.essentials.components.eventsourced.eventstore.serializer.EventSerializer;
import dk.cloudcreate.essentials.jackson.types.EssentialTypesJacksonModule;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventSerializer} that uses Jackson to serialize events and their metadata to JSON.<br>
 * The Fully Qualified Class Name of the event is stored as {@link PersistableEvent#eventType()} and in the
 * {@link #EVENT_CLR_TYPE_HEADER} header, and is used to resolve the Java type during deserialization.<br>
 * Events that implement {@link CorrelatedMessage} keep their {@link CorrelatedMessage#messageId()} as event id, and their
 * correlation values are copied into the {@link #MESSAGE_ID_HEADER}, {@link #CORRELATION_ID_HEADER} and {@link #CAUSATION_ID_HEADER} headers
 *
 * @see #createObjectMapper()
 */
public class JacksonEventSerializer implements EventSerializer {
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Create a {@link JacksonEventSerializer} that uses {@link #createObjectMapper()}
     */
    public static JacksonEventSerializer standardSerializer() {
        return new JacksonEventSerializer(createObjectMapper());
    }

    /**
     * Create an {@link ObjectMapper} that serializes events using their fields (getters and setters are ignored),
     * ignores unknown properties during deserialization and supports all essentials single value types
     * through the {@link EssentialTypesJacksonModule}
     */
    public static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                         .disable(MapperFeature.AUTO_DETECT_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                         .disable(MapperFeature.AUTO_DETECT_SETTERS)
                         .disable(MapperFeature.DEFAULT_VIEW_INCLUSION)
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .enable(MapperFeature.AUTO_DETECT_CREATORS)
                         .enable(MapperFeature.AUTO_DETECT_FIELDS)
                         .enable(MapperFeature.PROPAGATE_TRANSIENT_MARKER)
                         .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                         .addModule(new EssentialTypesJacksonModule())
                         .build();
    }

    @Override
    public PersistableEvent serialize(Object event, Map<String, Object> headers) {
        requireNonNull(event, "No event provided");
        requireNonNull(headers, "No headers provided");

        var eventType = event.getClass().getName();
        var metaData  = new LinkedHashMap<>(headers);
        metaData.put(EVENT_CLR_TYPE_HEADER, eventType);

        var eventId = MessageId.random();
        if (event instanceof CorrelatedMessage) {
            var correlatedEvent = (CorrelatedMessage) event;
            if (correlatedEvent.messageId() != null) {
                eventId = correlatedEvent.messageId();
                metaData.put(MESSAGE_ID_HEADER, correlatedEvent.messageId().toString());
            }
            if (correlatedEvent.correlationId() != null) {
                metaData.put(CORRELATION_ID_HEADER, correlatedEvent.correlationId().toString());
            }
            if (correlatedEvent.causationId() != null) {
                metaData.put(CAUSATION_ID_HEADER, correlatedEvent.causationId().toString());
            }
        }

        try {
            return new PersistableEvent(eventId,
                                        eventType,
                                        objectMapper.writeValueAsString(event),
                                        objectMapper.writeValueAsString(metaData));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize event of type '{}'", eventType), e);
        }
    }

    @Override
    public Object deserialize(PersistedEvent persistedEvent) {
        requireNonNull(persistedEvent, "No persistedEvent provided");
        Class<?> javaType;
        try {
            javaType = Class.forName(persistedEvent.eventType(), true, resolveClassLoader());
        } catch (ClassNotFoundException e) {
            throw new JSONDeserializationException(msg("Couldn't resolve the Java type '{}' of event '{}' in stream '{}'",
                                                       persistedEvent.eventType(),
                                                       persistedEvent.eventId(),
                                                       persistedEvent.streamName()),
                                                   e);
        }
        try {
            return objectMapper.readValue(persistedEvent.jsonData(), javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize event '{}' of type '{}' in stream '{}'",
                                                       persistedEvent.eventId(),
                                                       persistedEvent.eventType(),
                                                       persistedEvent.streamName()),
                                                   e);
        }
    }

    @Override
    public Map<String, Object> deserializeMetaData(PersistedEvent persistedEvent) {
        requireNonNull(persistedEvent, "No persistedEvent provided");
        try {
            return objectMapper.readValue(persistedEvent.jsonMetaData(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize the metadata of event '{}' in stream '{}'",
                                                       persistedEvent.eventId(),
                                                       persistedEvent.streamName()),
                                                   e);
        }
    }

    private static ClassLoader resolveClassLoader() {
        var contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : JacksonEventSerializer.class.getClassLoader();
    }
}
