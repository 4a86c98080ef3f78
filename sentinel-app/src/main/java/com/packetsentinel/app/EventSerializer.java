package com.packetsentinel.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.packetsentinel.core.model.Alert;
import com.packetsentinel.core.model.TrafficStatsSnapshot;

/**
 * Converts {@link Alert}s and {@link TrafficStatsSnapshot}s to JSON bytes
 * for publishing. Timestamps are written as ISO-8601 strings.
 *
 * <p>
 * Unlike packet deserialization, a failure here is not skipped silently: it
 * is rethrown as {@link IllegalStateException} so that the retrying writer
 * sees it and counts the lost write.
 * </p>
 */
public class EventSerializer {

    private final ObjectMapper mapper;

    public EventSerializer() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public byte[] serialize(Alert alert) {
        return write(alert, "alert " + alert.getId());
    }

    public byte[] serialize(TrafficStatsSnapshot snapshot) {
        return write(snapshot, "stats snapshot ending " + snapshot.getWindowEnd());
    }

    private byte[] write(Object value, String what) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
