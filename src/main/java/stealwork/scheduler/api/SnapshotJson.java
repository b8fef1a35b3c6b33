package stealwork.scheduler.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import stealwork.scheduler.api.dto.SchedulerSnapshot;

import java.io.UncheckedIOException;

/**
 * JSON rendering of scheduler snapshots.
 * Timestamps are written as ISO-8601 strings, not epoch numbers.
 */
public final class SnapshotJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private SnapshotJson() {
    }

    public static String toJson(SchedulerSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize scheduler snapshot", e);
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
