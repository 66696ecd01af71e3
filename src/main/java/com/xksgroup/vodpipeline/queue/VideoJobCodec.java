package com.xksgroup.vodpipeline.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.exception.MalformedJobException;
import com.xksgroup.vodpipeline.model.job.VideoJob;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a {@link VideoJob} to the stream entry fields shared by producers and workers.
 */
public class VideoJobCodec {

    public static final String FIELD_JOB_ID = "job_id";
    public static final String FIELD_SOURCE_LOCATION = "source_location";
    public static final String FIELD_ORIGINAL_NAME = "original_name";
    public static final String FIELD_PAYLOAD = "payload";
    public static final String FIELD_ENQUEUED_AT = "enqueued_at";

    private final ObjectMapper objectMapper;

    public VideoJobCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, String> encode(VideoJob job, Instant enqueuedAt) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize job " + job.getJobId(), e);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(FIELD_JOB_ID, job.getJobId());
        fields.put(FIELD_SOURCE_LOCATION, job.getSourceLocation());
        fields.put(FIELD_ORIGINAL_NAME, job.getOriginalName() != null ? job.getOriginalName() : "");
        fields.put(FIELD_PAYLOAD, payload);
        fields.put(FIELD_ENQUEUED_AT, String.valueOf(enqueuedAt.getEpochSecond()));
        return fields;
    }

    public VideoJob decode(QueueEntry entry) throws MalformedJobException {
        String payload = entry.getFields() != null ? entry.getFields().get(FIELD_PAYLOAD) : null;
        if (payload == null || payload.isBlank()) {
            throw new MalformedJobException(entry.getEntryId(), "missing or invalid payload field");
        }

        VideoJob job;
        try {
            job = objectMapper.readValue(payload, VideoJob.class);
        } catch (JsonProcessingException e) {
            throw new MalformedJobException(entry.getEntryId(), "failed to unmarshal job: " + e.getOriginalMessage(), e);
        }

        if (job.getJobId() == null || job.getJobId().isBlank()) {
            throw new MalformedJobException(entry.getEntryId(), "job_id is missing");
        }
        // The id names the job's scratch directory
        if (!isSafeId(job.getJobId())) {
            throw new MalformedJobException(entry.getEntryId(), "job_id is not a valid identifier: " + job.getJobId());
        }
        if (job.getSourceLocation() == null || job.getSourceLocation().isBlank()) {
            throw new MalformedJobException(entry.getEntryId(), "source_location is missing for job " + job.getJobId());
        }
        return job;
    }

    static boolean isSafeId(String jobId) {
        return !jobId.contains("/")
                && !jobId.contains("\\")
                && !jobId.contains("..")
                && !jobId.equals(".");
    }
}
