package com.promptsmith.infrastructure.recording;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.promptsmith.domain.prompt.model.RecordEntry;
import com.promptsmith.domain.prompt.service.Recorder;
import com.promptsmith.infrastructure.orchestrator.OrchestrationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes each record as one JSON line to the {@code promptsmith.records} logger.
 */
@Component
@RequiredArgsConstructor
public class LoggingRecorder implements Recorder {

    static final String RECORDS_LOGGER = "promptsmith.records";

    private static final Logger records = LoggerFactory.getLogger(RECORDS_LOGGER);

    private final ObjectMapper objectMapper;

    @Override
    public void record(RecordEntry entry) {
        records.info(toJson(entry));
    }

    String toJson(RecordEntry entry) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("kind", entry.kind().name());
        body.put("timestamp", entry.timestamp() != null ? entry.timestamp().toString() : null);
        body.put("score", entry.score());
        body.put("method", entry.method() != null ? entry.method().id() : null);
        body.put("scoreImprovement", entry.scoreImprovement());
        if (entry.context() != null) {
            body.put("complexity", entry.context().complexity().name());
            body.put("frameworks", entry.context().frameworks());
            body.put("projectType", entry.context().projectType());
        }
        body.put("length", entry.text() != null ? entry.text().length() : 0);
        body.put("text", entry.text());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new OrchestrationException("Failed to serialize " + entry.kind() + " record", e);
        }
    }
}
