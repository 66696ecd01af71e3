package com.xksgroup.vodpipeline.service.helper;

import com.xksgroup.vodpipeline.service.transcode.TranscodeProgressListener;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external media tools, captures their output and turns ffmpeg's progress lines into ticks.
 */
@Slf4j
public class ProcessHelper {

    private static final int STDERR_TAIL_LINES = 20;

    private final ExecutorService executorService = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "process-output-reader");
        thread.setDaemon(true);
        return thread;
    });

    // Running processes by job id
    private final ConcurrentHashMap<String, Process> runningProcesses = new ConcurrentHashMap<>();

    /**
     * Start {@code command}, wait for it and return its exit code and output. Interrupting the
     * calling thread kills the process and rethrows the interrupt.
     */
    public ProcessResult run(List<String> command, String description, String jobId,
                             TranscodeProgressListener listener, Path workingDirectory)
            throws IOException, InterruptedException {

        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workingDirectory != null ? workingDirectory.toFile() : null);
        pb.environment().put("MALLOC_ARENA_MAX", "2");

        log.info("Starting {}", description);
        log.debug("Command: {}", String.join(" ", command));

        Process process = pb.start();
        if (jobId != null) {
            runningProcesses.put(jobId, process);
        }

        StringBuilder stdout = new StringBuilder();
        Deque<String> stderrTail = new ArrayDeque<>();

        Future<?> stdoutTask = executorService.submit(() -> readStdout(process, stdout));
        Future<?> stderrTask = executorService.submit(() ->
                readStderr(process, description, listener != null ? listener : TranscodeProgressListener.NONE, stderrTail));

        try {
            int exit = process.waitFor();
            awaitReader(stdoutTask, jobId);
            awaitReader(stderrTask, jobId);

            if (exit != 0) {
                log.error("{} failed with exit code: {}", description, exit);
            } else {
                log.info("Completed {}", description);
            }
            String tail;
            synchronized (stderrTail) {
                tail = String.join("\n", stderrTail);
            }
            String out;
            synchronized (stdout) {
                out = stdout.toString();
            }
            return new ProcessResult(exit, out, tail);

        } catch (InterruptedException e) {
            log.warn("{} interrupted for job: {}", description, jobId);
            process.destroyForcibly();
            stdoutTask.cancel(true);
            stderrTask.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            if (jobId != null) {
                runningProcesses.remove(jobId, process);
            }
        }
    }

    public void shutdown() {
        runningProcesses.values().forEach(Process::destroyForcibly);
        runningProcesses.clear();
        executorService.shutdownNow();
    }

    private void readStdout(Process process, StringBuilder stdout) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (stdout) {
                    stdout.append(line).append('\n');
                }
            }
        } catch (IOException e) {
            if (!Thread.currentThread().isInterrupted()) {
                log.warn("Error reading process stdout: {}", e.getMessage());
            }
        }
    }

    private void readStderr(Process process, String description, TranscodeProgressListener listener,
                            Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            double totalDuration = 0.0;
            int lastLoggedProgress = -1;

            while ((line = reader.readLine()) != null) {
                remember(tail, line);
                if (line.contains("Error") || line.contains("error") || line.contains("failed")) {
                    log.warn("{} stderr: {}", description, line);
                } else {
                    log.trace("{} stderr: {}", description, line);
                }

                double currentTimeSeconds = parseCurrentTime(line);
                if (currentTimeSeconds >= 0 && totalDuration > 0) {
                    double progressPercent = Math.min(100.0, (currentTimeSeconds / totalDuration) * 100.0);
                    int progressInt = (int) Math.floor(progressPercent);

                    if (progressInt != lastLoggedProgress && progressInt % 10 == 0) {
                        log.info("{} progress: {}% ({}s / {}s)", description, progressInt,
                                String.format("%.1f", currentTimeSeconds),
                                String.format("%.1f", totalDuration));
                        lastLoggedProgress = progressInt;
                    }
                    try {
                        listener.onProgress(progressInt, currentTimeSeconds, totalDuration);
                    } catch (RuntimeException e) {
                        log.debug("Progress listener failed for {}: {}", description, e.getMessage());
                    }
                }

                double duration = parseTotalDuration(line);
                if (duration > 0) {
                    totalDuration = duration;
                    log.debug("{} detected total duration: {} seconds", description, totalDuration);
                }
            }
        } catch (IOException e) {
            if (!Thread.currentThread().isInterrupted()) {
                log.warn("Error reading process stderr: {}", e.getMessage());
            }
        }
    }

    private static void remember(Deque<String> tail, String line) {
        synchronized (tail) {
            if (tail.size() == STDERR_TAIL_LINES) {
                tail.removeFirst();
            }
            tail.addLast(line);
        }
    }

    private static void awaitReader(Future<?> task, String jobId) throws InterruptedException {
        try {
            task.get(10, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Timeout waiting for output reader to finish for job: {}", jobId);
            task.cancel(true);
        } catch (ExecutionException e) {
            log.warn("Output reader failed for job {}: {}", jobId, e.getCause().getMessage());
        }
    }

    /**
     * Seconds of output produced so far, from {@code -progress} lines ({@code out_time_ms=})
     * or the classic {@code time=} stat. Returns -1 when the line carries no time.
     */
    static double parseCurrentTime(String line) {
        if (line.startsWith("out_time_ms=")) {
            String value = line.substring(12).trim();
            if ("N/A".equals(value)) {
                return -1;
            }
            try {
                // microseconds despite the name
                return Double.parseDouble(value) / 1_000_000.0;
            } catch (NumberFormatException e) {
                log.debug("Failed to parse out_time_ms from line: {}", line);
                return -1;
            }
        }
        int idx = line.indexOf("time=");
        if (idx >= 0 && (idx == 0 || line.charAt(idx - 1) == ' ')) {
            String rest = line.substring(idx + 5).trim();
            int end = rest.indexOf(' ');
            return parseTimeString(end > 0 ? rest.substring(0, end) : rest);
        }
        return -1;
    }

    /**
     * Input duration from the {@code Duration: 00:05:00.40, start: ...} banner line.
     */
    static double parseTotalDuration(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("Duration:")) {
            return -1;
        }
        String[] parts = trimmed.split(",");
        return parseTimeString(parts[0].substring(9).trim());
    }

    /**
     * Parse time string in various formats (HH:MM:SS.ss, MM:SS.ss or seconds)
     */
    static double parseTimeString(String timeStr) {
        if (timeStr == null || timeStr.isBlank() || "N/A".equals(timeStr.trim())) {
            return -1;
        }
        String value = timeStr.trim();
        try {
            if (!value.contains(":")) {
                return Double.parseDouble(value);
            }
            String[] parts = value.split(":");
            if (parts.length == 3) {
                return Integer.parseInt(parts[0]) * 3600 + Integer.parseInt(parts[1]) * 60 + Double.parseDouble(parts[2]);
            } else if (parts.length == 2) {
                return Integer.parseInt(parts[0]) * 60 + Double.parseDouble(parts[1]);
            }
        } catch (NumberFormatException e) {
            log.debug("Failed to parse time string: {}", value);
        }
        return -1;
    }

    public static final class ProcessResult {
        private final int exitCode;
        private final String stdout;
        private final String stderrTail;

        public ProcessResult(int exitCode, String stdout, String stderrTail) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderrTail = stderrTail;
        }

        public int getExitCode() {
            return exitCode;
        }

        public String getStdout() {
            return stdout;
        }

        public String getStderrTail() {
            return stderrTail;
        }

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
