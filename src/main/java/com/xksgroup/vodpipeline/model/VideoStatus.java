package com.xksgroup.vodpipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VideoStatus {
    WAITING,        // Asset created, entry queued
    PROCESSING,     // A worker owns the entry and is running the pipeline
    COMPLETED,      // All renditions and the master manifest are stored
    FAILED;         // Probe, transcode or upload failed

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * A failed or half-processed asset may be picked up again when its entry is redelivered.
     * A waiting asset fails directly when its job never reaches the queue.
     * Completed assets never leave their state.
     */
    public boolean canTransitionTo(VideoStatus next) {
        switch (this) {
            case WAITING:
                return next == PROCESSING || next == FAILED;
            case FAILED:
                return next == PROCESSING;
            case PROCESSING:
                return next != WAITING;
            case COMPLETED:
            default:
                return false;
        }
    }

    public VideoStatus transitionTo(VideoStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Invalid status transition " + this + " -> " + next);
        }
        return next;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VideoStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        return VideoStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
