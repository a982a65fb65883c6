package com.ivamare.ordersession.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;
import java.util.Set;

/**
 * Converts session events to and from their JSON payloads.
 *
 * <p>Type names resolve through a fixed registry; nothing is looked up reflectively
 * by name. Unregistered types decode to {@link UnknownSessionEvent} so that streams
 * written by newer versions still fold. Unknown properties are ignored and missing
 * optional properties take their defaults.
 */
public class SessionEventCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final Map<String, Class<? extends SessionEvent>> EVENT_TYPES = Map.of(
        SessionInitiated.TYPE, SessionInitiated.class,
        ItemAdded.TYPE, ItemAdded.class,
        ItemRemoved.TYPE, ItemRemoved.class,
        ItemModified.TYPE, ItemModified.class,
        CustomerInfoEntered.TYPE, CustomerInfoEntered.class,
        DiscountApplied.TYPE, DiscountApplied.class,
        PaymentRecorded.TYPE, PaymentRecorded.class,
        SessionClosed.TYPE, SessionClosed.class,
        SessionVoided.TYPE, SessionVoided.class
    );

    private final ObjectMapper objectMapper;

    public SessionEventCodec() {
        this(defaultObjectMapper());
    }

    public SessionEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Mapper configured for event and snapshot payloads.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static Set<String> knownTypes() {
        return EVENT_TYPES.keySet();
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Serialize an event payload.
     *
     * @param event the event
     * @return JSON payload
     */
    public String encode(SessionEvent event) {
        try {
            if (event instanceof UnknownSessionEvent unknown) {
                return objectMapper.writeValueAsString(unknown.payload());
            }
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.type() + " event", e);
        }
    }

    /**
     * Deserialize a payload of the given type.
     *
     * @param type stored type name
     * @param payload JSON payload
     * @return the typed event, or an {@link UnknownSessionEvent} for unregistered types
     */
    public SessionEvent decode(String type, String payload) {
        Class<? extends SessionEvent> eventClass = EVENT_TYPES.get(type);
        try {
            if (eventClass == null) {
                Map<String, Object> raw = payload == null || payload.isBlank()
                    ? Map.of()
                    : objectMapper.readValue(payload, MAP_TYPE);
                return new UnknownSessionEvent(type, raw);
            }
            return objectMapper.readValue(payload, eventClass);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type + " event", e);
        }
    }
}
