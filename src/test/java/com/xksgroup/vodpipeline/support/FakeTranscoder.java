package com.xksgroup.vodpipeline.support;

import com.xksgroup.vodpipeline.exception.ProbeException;
import com.xksgroup.vodpipeline.exception.TranscodeException;
import com.xksgroup.vodpipeline.service.transcode.MediaProbe;
import com.xksgroup.vodpipeline.service.transcode.RenditionSpec;
import com.xksgroup.vodpipeline.service.transcode.TranscodeOutput;
import com.xksgroup.vodpipeline.service.transcode.TranscodeProgressListener;
import com.xksgroup.vodpipeline.service.transcode.Transcoder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Writes two tiny segments and a playlist per rendition under {@code workDir}.
 */
public class FakeTranscoder implements Transcoder {

    public final List<String> labels = new CopyOnWriteArrayList<>();
    public final AtomicInteger probeCalls = new AtomicInteger();

    public volatile ProbeException probeFailure;
    public volatile String failOn;
    // Label after which the running thread is interrupted, as a cancel landing mid-rendition would
    public volatile String interruptAfter;
    // Spin time per rendition; interrupts are ignored while spinning, like an encoder that never checks
    public volatile long busyMillis;

    private final Path workDir;
    private final MediaProbe probe;

    public FakeTranscoder(Path workDir, MediaProbe probe) {
        this.workDir = workDir;
        this.probe = probe;
    }

    @Override
    public MediaProbe probe(String sourceLocation) throws ProbeException {
        probeCalls.incrementAndGet();
        if (probeFailure != null) {
            throw probeFailure;
        }
        return probe;
    }

    @Override
    public TranscodeOutput transcode(String jobId, String sourceLocation, RenditionSpec spec,
                                     TranscodeProgressListener listener) throws TranscodeException {
        labels.add(spec.getLabel());
        if (spec.getLabel().equals(failOn)) {
            throw new TranscodeException("ffmpeg exited with code 1");
        }
        spin(busyMillis);
        listener.onProgress(50, 15, 30);
        listener.onProgress(100, 30, 30);

        // A pending interrupt would close the file channels, so the fixture is written with it held back
        boolean interrupted = Thread.interrupted();
        try {
            return writeOutput(jobId, spec.getLabel());
        } finally {
            if (interrupted || spec.getLabel().equals(interruptAfter)) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private TranscodeOutput writeOutput(String jobId, String label) throws TranscodeException {
        try {
            Path dir = Files.createDirectories(workDir.resolve(jobId).resolve(label));
            Path first = Files.write(dir.resolve("segment_000.ts"), new byte[188]);
            Path second = Files.write(dir.resolve("segment_001.ts"), new byte[188]);
            Path playlist = Files.writeString(dir.resolve("playlist.m3u8"), "#EXTM3U\n");
            return new TranscodeOutput(dir, playlist, List.of(first, second));
        } catch (IOException e) {
            throw new TranscodeException("cannot write fixture", e);
        }
    }

    private static void spin(long millis) {
        long until = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
        while (System.nanoTime() < until) {
            Thread.onSpinWait();
        }
    }
}
