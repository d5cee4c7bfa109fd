package org.optiroute.routing.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * JSON codec for {@link SavedRoutePayload}. Instants are written as ISO-8601 strings.
 */
public final class SavedRoutePayloadCodec {
    private final ObjectMapper objectMapper;

    public SavedRoutePayloadCodec() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public SavedRoutePayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String encode(SavedRoutePayload payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new SavedRouteStoreException(
                    SavedRouteStoreException.REASON_PAYLOAD_INVALID,
                    "cannot encode route payload",
                    e
            );
        }
    }

    /**
     * Parses a stored payload.
     *
     * @throws SavedRouteStoreException with {@code STORE_PAYLOAD_INVALID} on malformed JSON.
     */
    public SavedRoutePayload decode(String json) {
        if (json == null || json.isBlank()) {
            throw new SavedRouteStoreException(SavedRouteStoreException.REASON_PAYLOAD_INVALID, "payload is empty");
        }
        try {
            return objectMapper.readValue(json, SavedRoutePayload.class);
        } catch (JsonProcessingException e) {
            throw new SavedRouteStoreException(
                    SavedRouteStoreException.REASON_PAYLOAD_INVALID,
                    "cannot decode route payload: " + e.getOriginalMessage(),
                    e
            );
        }
    }
}
