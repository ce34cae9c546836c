package com.di.chunkpilot.agent.planner;

import com.di.chunkpilot.exception.ChunkPilotException;
import com.di.chunkpilot.worker.BackendType;
import com.di.chunkpilot.worker.WorkerCreationStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DecisionRecordCodec Tests")
class DecisionRecordCodecTest {

    private final DecisionRecordCodec codec = new DecisionRecordCodec();

    private static DecisionRecord record() {
        return new DecisionRecord(6, 12, BackendType.ISOLATED_WORKER, WorkerCreationStrategy.CHILD_JVM,
                4.25, true, "measured", DecisionRecord.SCHEMA_VERSION, Instant.parse("2026-03-14T09:26:53Z"));
    }

    @Test
    @DisplayName("Encoded record uses ISO timestamps and enum names")
    void encode_readableJson() {
        String json = codec.encode(record());

        assertTrue(json.contains("\"createdAt\":\"2026-03-14T09:26:53Z\""), json);
        assertTrue(json.contains("\"backend\":\"ISOLATED_WORKER\""), json);
        assertTrue(json.contains("\"schemaVersion\":1"), json);
    }

    @Test
    @DisplayName("Decoding restores every field")
    void decode_restores() {
        assertEquals(record(), codec.decode(codec.encode(record())));
    }

    @Test
    @DisplayName("Unknown fields written by newer producers are ignored")
    void decode_ignoresUnknownFields() {
        String json = "{\"workerCount\":2,\"batchSize\":5,\"backend\":\"SHARED_MEMORY_WORKER\","
                + "\"creationStrategy\":\"FORK_JOIN\",\"estimatedSpeedup\":1.5,\"adaptiveChunking\":false,"
                + "\"provenance\":\"advisor\",\"schemaVersion\":1,\"createdAt\":\"2026-01-01T00:00:00Z\","
                + "\"host\":\"node-7\"}";
        DecisionRecord decoded = codec.decode(json);

        assertEquals(2, decoded.workerCount());
        assertEquals(BackendType.SHARED_MEMORY_WORKER, decoded.backend());
    }

    @Test
    @DisplayName("Records from another schema version are rejected")
    void decode_rejectsOtherSchema() {
        String json = codec.encode(record()).replace("\"schemaVersion\":1", "\"schemaVersion\":99");
        ChunkPilotException e = assertThrows(ChunkPilotException.class, () -> codec.decode(json));
        assertTrue(e.getMessage().contains("99"));
    }

    @Test
    @DisplayName("Malformed JSON is wrapped")
    void decode_malformed() {
        ChunkPilotException e = assertThrows(ChunkPilotException.class, () -> codec.decode("{not json"));
        assertNotNull(e.getCause());
    }
}
