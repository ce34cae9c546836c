package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.exception.ChunkPilotException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of {@link DecisionRecord}s for external persistence layers.
 */
@Slf4j
@Component
public class DecisionRecordCodec {

    private final ObjectMapper objectMapper;

    public DecisionRecordCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(DecisionRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new ChunkPilotException("Failed to encode decision record", e);
        }
    }

    /**
     * @throws ChunkPilotException when the JSON is malformed or was written by another schema version
     */
    public DecisionRecord decode(String json) {
        DecisionRecord record;
        try {
            record = objectMapper.readValue(json, DecisionRecord.class);
        } catch (JsonProcessingException e) {
            throw new ChunkPilotException("Failed to decode decision record", e);
        }
        if (record.schemaVersion() != DecisionRecord.SCHEMA_VERSION) {
            throw new ChunkPilotException("Unsupported decision record schema " + record.schemaVersion()
                    + " (expected " + DecisionRecord.SCHEMA_VERSION + ")");
        }
        log.debug("[PLANNER] decoded record workers={} batch={}", record.workerCount(), record.batchSize());
        return record;
    }
}
