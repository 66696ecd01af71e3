package com.xksgroup.vodpipeline.service.transcode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.vodpipeline.exception.ProbeException;

/**
 * Reads the {@code ffprobe -print_format json -show_streams -show_format} document.
 */
public class FfprobeParser {

    private final ObjectMapper objectMapper;

    public FfprobeParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public MediaProbe parse(String json) throws ProbeException {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProbeException("Unreadable ffprobe output", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ProbeException("Empty ffprobe output");
        }

        int width = 0;
        int height = 0;
        boolean hasVideo = false;
        boolean hasAudio = false;
        JsonNode streams = root.path("streams");
        if (streams.isArray()) {
            for (JsonNode stream : streams) {
                String codecType = stream.path("codec_type").asText("");
                if ("video".equalsIgnoreCase(codecType) && !hasVideo) {
                    hasVideo = true;
                    width = stream.path("width").asInt(0);
                    height = stream.path("height").asInt(0);
                } else if ("audio".equalsIgnoreCase(codecType)) {
                    hasAudio = true;
                }
            }
        }

        if (!hasVideo) {
            throw new ProbeException("No video stream found");
        }
        if (width <= 0 || height <= 0) {
            throw new ProbeException("Invalid video dimensions " + width + "x" + height);
        }

        JsonNode format = root.path("format");
        // ffprobe reports numbers as strings here
        double duration = format.path("duration").asDouble(0.0);
        long bitrate = format.path("bit_rate").asLong(0L);

        return MediaProbe.builder()
                .width(width)
                .height(height)
                .durationSeconds(duration)
                .bitrate(bitrate)
                .hasAudio(hasAudio)
                .build();
    }
}
