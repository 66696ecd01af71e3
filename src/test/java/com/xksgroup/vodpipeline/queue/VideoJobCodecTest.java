package com.xksgroup.vodpipeline.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.exception.MalformedJobException;
import com.xksgroup.vodpipeline.model.job.VideoJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VideoJobCodecTest {

    private final VideoJobCodec codec = new VideoJobCodec(new ObjectMapper());

    @Test
    void writesFlatFieldsAlongsidePayload() throws Exception {
        VideoJob job = VideoJob.builder().jobId("v1").sourceLocation("/data/in.mp4").originalName("in.mp4").build();

        Map<String, String> fields = codec.encode(job, Instant.ofEpochSecond(1_700_000_000L));

        assertThat(fields)
                .containsEntry(VideoJobCodec.FIELD_JOB_ID, "v1")
                .containsEntry(VideoJobCodec.FIELD_SOURCE_LOCATION, "/data/in.mp4")
                .containsEntry(VideoJobCodec.FIELD_ORIGINAL_NAME, "in.mp4")
                .containsEntry(VideoJobCodec.FIELD_ENQUEUED_AT, "1700000000");
        assertThat(fields.get(VideoJobCodec.FIELD_PAYLOAD)).contains("\"job_id\":\"v1\"");

        VideoJob decoded = codec.decode(new QueueEntry("1-0", fields));
        assertThat(decoded).isEqualTo(job);
    }

    @Test
    void missingOriginalNameIsWrittenEmpty() {
        VideoJob job = VideoJob.builder().jobId("v2").sourceLocation("s3://in/v2.mov").build();

        assertThat(codec.encode(job, Instant.EPOCH)).containsEntry(VideoJobCodec.FIELD_ORIGINAL_NAME, "");
    }

    @Test
    void rejectsEntryWithoutPayload() {
        QueueEntry entry = new QueueEntry("5-0", Map.of(VideoJobCodec.FIELD_JOB_ID, "v3"));

        assertThatThrownBy(() -> codec.decode(entry))
                .isInstanceOf(MalformedJobException.class)
                .hasMessageContaining("payload")
                .extracting(e -> ((MalformedJobException) e).getEntryId())
                .isEqualTo("5-0");
    }

    @Test
    void rejectsUnparseablePayload() {
        QueueEntry entry = new QueueEntry("6-0", Map.of(VideoJobCodec.FIELD_PAYLOAD, "{not json"));

        assertThatThrownBy(() -> codec.decode(entry)).isInstanceOf(MalformedJobException.class);
    }

    @Test
    void rejectsPayloadWithoutSource() {
        Map<String, String> fields = new HashMap<>();
        fields.put(VideoJobCodec.FIELD_PAYLOAD, "{\"job_id\":\"v4\",\"source_location\":\"\"}");

        assertThatThrownBy(() -> codec.decode(new QueueEntry("7-0", fields)))
                .isInstanceOf(MalformedJobException.class)
                .hasMessageContaining("source_location");
    }

    @ParameterizedTest
    @ValueSource(strings = {"../../etc", "a/b", "..", "v1\\..\\tmp", "."})
    void rejectsJobIdThatIsNotASingleName(String jobId) {
        Map<String, String> fields = codec.encode(
                VideoJob.builder().jobId(jobId).sourceLocation("/data/in.mp4").build(), Instant.EPOCH);

        assertThatThrownBy(() -> codec.decode(new QueueEntry("8-0", fields)))
                .isInstanceOf(MalformedJobException.class)
                .hasMessageContaining("job_id");
    }
}
