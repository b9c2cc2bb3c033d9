package com.vistela.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Conventional lifecycle of a video. Records may carry other values; only status
 * updates are checked against this table.
 */
public enum VideoStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static final VideoStatus DEFAULT = PENDING;

    /**
     * Column value, e.g. "pending"
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Set<VideoStatus> allowedTargets() {
        switch (this) {
            case PENDING:
                return EnumSet.of(PROCESSING);
            case PROCESSING:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return EnumSet.noneOf(VideoStatus.class);
        }
    }

    public boolean canMoveTo(VideoStatus target) {
        return allowedTargets().contains(target);
    }

    /**
     * Statuses from which {@code target} may be reached.
     */
    public static Set<VideoStatus> predecessorsOf(VideoStatus target) {
        Set<VideoStatus> predecessors = EnumSet.noneOf(VideoStatus.class);
        for (VideoStatus status : values()) {
            if (status.canMoveTo(target)) {
                predecessors.add(status);
            }
        }
        return predecessors;
    }

    public static Optional<VideoStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (VideoStatus status : values()) {
            if (status.value().equals(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
