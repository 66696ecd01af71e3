package com.xksgroup.vodpipeline.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.model.progress.ProgressEvent;

public class ProgressEventCodec {

    private final ObjectMapper objectMapper;

    public ProgressEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(ProgressEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize progress event for job " + event.getJobId(), e);
        }
    }

    public ProgressEvent decode(String json) {
        try {
            return objectMapper.readValue(json, ProgressEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed progress event: " + e.getOriginalMessage(), e);
        }
    }
}
