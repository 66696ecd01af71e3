package com.xksgroup.vodpipeline.service.transcode;

import com.xksgroup.vodpipeline.exception.ProbeException;
import com.xksgroup.vodpipeline.exception.TranscodeException;
import com.xksgroup.vodpipeline.service.helper.MasterManifestBuilder;
import com.xksgroup.vodpipeline.service.helper.ProcessHelper;
import com.xksgroup.vodpipeline.service.helper.ProcessHelper.ProcessResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Transcoder backed by the ffprobe and ffmpeg binaries. Each rendition is a separate ffmpeg run
 * writing an HLS VOD playlist and MPEG-TS segments into its own scratch directory.
 */
@Slf4j
public class FFmpegTranscoder implements Transcoder {

    public static final String SEGMENT_PATTERN = "segment_%03d.ts";

    private final ProcessHelper processHelper;
    private final FfprobeParser probeParser;
    private final Path workDirectory;
    private final String ffmpegBinary;
    private final String ffprobeBinary;
    private final String preset;
    private final int crf;
    private final int segmentSeconds;

    public FFmpegTranscoder(ProcessHelper processHelper, FfprobeParser probeParser, Path workDirectory,
                            String ffmpegBinary, String ffprobeBinary,
                            String preset, int crf, int segmentSeconds) {
        this.processHelper = processHelper;
        this.probeParser = probeParser;
        this.workDirectory = workDirectory;
        this.ffmpegBinary = ffmpegBinary;
        this.ffprobeBinary = ffprobeBinary;
        this.preset = preset;
        this.crf = crf;
        this.segmentSeconds = segmentSeconds;
    }

    @Override
    public MediaProbe probe(String sourceLocation) throws ProbeException, InterruptedException {
        List<String> command = List.of(
                ffprobeBinary, "-v", "quiet",
                "-print_format", "json",
                "-show_streams", "-show_format",
                sourceLocation
        );

        ProcessResult result;
        try {
            result = processHelper.run(command, "ffprobe", null, null, null);
        } catch (IOException e) {
            throw new ProbeException("Failed to start ffprobe: " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new ProbeException("ffprobe exited with code " + result.getExitCode());
        }

        MediaProbe probe = probeParser.parse(result.getStdout());
        log.info("Probed {}: {}x{}, {}s, audio={}", sourceLocation,
                probe.getWidth(), probe.getHeight(), probe.getDurationSeconds(), probe.isHasAudio());
        return probe;
    }

    @Override
    public TranscodeOutput transcode(String jobId, String sourceLocation, RenditionSpec spec,
                                     TranscodeProgressListener listener) throws TranscodeException, InterruptedException {
        Path outputDir;
        try {
            outputDir = Files.createDirectories(workDirectory.resolve(jobId).resolve(spec.getLabel()));
        } catch (IOException e) {
            throw new TranscodeException("Cannot create output directory for " + spec.getLabel(), e);
        }

        TranscodeOutput output = new TranscodeOutput(outputDir, null, List.of());
        boolean succeeded = false;
        try {
            Path playlist = outputDir.resolve(MasterManifestBuilder.VARIANT_PLAYLIST_NAME);
            List<String> command = buildCommand(sourceLocation, spec, outputDir, playlist);

            ProcessResult result;
            try {
                result = processHelper.run(command, "ffmpeg " + spec.getLabel(), jobId, listener, outputDir);
            } catch (IOException e) {
                throw new TranscodeException("Failed to start ffmpeg: " + e.getMessage(), e);
            }
            if (!result.isSuccess()) {
                throw new TranscodeException("ffmpeg exited with code " + result.getExitCode()
                        + lastLine(result.getStderrTail()));
            }
            if (!Files.isRegularFile(playlist)) {
                throw new TranscodeException("ffmpeg produced no playlist for " + spec.getLabel());
            }

            List<Path> segments = listSegments(outputDir);
            if (segments.isEmpty()) {
                throw new TranscodeException("ffmpeg produced no segments for " + spec.getLabel());
            }
            succeeded = true;
            return new TranscodeOutput(outputDir, playlist, segments);
        } finally {
            if (!succeeded) {
                output.close();
            }
        }
    }

    List<String> buildCommand(String sourceLocation, RenditionSpec spec, Path outputDir, Path playlist) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-y");
        command.add("-hide_banner");
        command.add("-fflags");
        command.add("+discardcorrupt");
        command.add("-i");
        command.add(sourceLocation);

        command.add("-vf");
        command.add("scale=-2:" + spec.getHeight());
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add(preset);
        command.add("-crf");
        command.add(String.valueOf(crf));

        if (spec.isIncludeAudio()) {
            command.add("-c:a");
            command.add("aac");
            command.add("-b:a");
            command.add(spec.getAudioBitrateKbps() + "k");
        } else {
            command.add("-an");
        }

        command.add("-f");
        command.add("hls");
        command.add("-hls_time");
        command.add(String.valueOf(segmentSeconds));
        command.add("-hls_playlist_type");
        command.add("vod");
        command.add("-hls_segment_type");
        command.add("mpegts");
        command.add("-hls_segment_filename");
        command.add(outputDir.resolve(SEGMENT_PATTERN).toString());
        command.add("-hls_flags");
        command.add("independent_segments");
        command.add("-start_number");
        command.add("0");

        command.add("-progress");
        command.add("pipe:2");
        command.add("-nostats");

        command.add(playlist.toString());
        return command;
    }

    private static List<Path> listSegments(Path outputDir) throws TranscodeException {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files
                    .filter(p -> p.getFileName().toString().endsWith(".ts"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TranscodeException("Cannot list segments in " + outputDir, e);
        }
    }

    private static String lastLine(String stderrTail) {
        if (stderrTail == null || stderrTail.isBlank()) {
            return "";
        }
        String[] lines = stderrTail.split("\n");
        return ": " + lines[lines.length - 1].trim();
    }
}
