package com.telcobright.reviewstats.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telcobright.reviewstats.core.job.JobResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders a job result as a single JSON object.
 *
 * Failed jobs put their failure message in {@code final_answer}, with empty
 * lists and a zero time.
 */
public class JobResultWriter {
    private final ObjectMapper mapper;

    public JobResultWriter() {
        this(new ObjectMapper());
    }

    public JobResultWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String toJson(JobResult<?> result) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        if (result.isSuccess()) {
            body.put("final_answer", result.getFinalAnswer());
            body.put("chunkSizePerThread", result.getChunkSizesPerWorker());
            body.put("answerPerThread", result.getDiagnosticCountsPerWorker());
            body.put("totalTimeTaken", result.getElapsedSeconds());
        } else {
            body.put("final_answer", result.getFailureMessage());
            body.put("chunkSizePerThread", Collections.emptyList());
            body.put("answerPerThread", Collections.emptyList());
            body.put("totalTimeTaken", 0.0);
        }
        return mapper.writeValueAsString(body);
    }
}
