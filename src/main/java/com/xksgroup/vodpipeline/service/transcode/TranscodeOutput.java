package com.xksgroup.vodpipeline.service.transcode;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Artifacts of one rendition in a scratch directory. Closing deletes the directory.
 */
@Slf4j
public class TranscodeOutput implements AutoCloseable {

    private final Path directory;
    private final Path playlist;
    private final List<Path> segments;

    public TranscodeOutput(Path directory, Path playlist, List<Path> segments) {
        this.directory = directory;
        this.playlist = playlist;
        this.segments = List.copyOf(segments);
    }

    public Path getDirectory() {
        return directory;
    }

    public Path getPlaylist() {
        return playlist;
    }

    public List<Path> getSegments() {
        return segments;
    }

    @Override
    public void close() {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Error deleting {}: {}", path, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Error cleaning up transcode directory {}: {}", directory, e.getMessage());
        }
    }
}
