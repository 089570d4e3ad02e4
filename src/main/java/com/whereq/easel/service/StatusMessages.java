package com.whereq.easel.service;

import java.util.Locale;

/**
 * Requester-facing status texts and the result caption
 */
public final class StatusMessages {

    public static final String QUEUED = "Queued, waiting for a free worker";
    public static final String GENERATING = "Generating...";
    public static final String CANCELED = "Canceled";
    public static final String CANCELED_BY_ADMIN = "Canceled by an administrator";
    public static final String TOPIC_NOT_FOUND = "Topic not found";
    public static final String REQUIRES_INPUT_IMAGE = "This topic requires an input image";
    public static final String UPLOAD_FAILED = "Uploading the input image failed";
    public static final String GENERATION_TIMEOUT = "Generation timed out";
    public static final String GENERATION_FAILED = "Generation failed";
    public static final String NO_MEDIA = "The engine produced no media";

    private StatusMessages() {
    }

    public static String engineError(String message) {
        return "Engine error: " + message;
    }

    /**
     * Caption delivered with the media. Queue time counts both the wait in this service and in the engine.
     */
    public static String caption(String prompt, double gatewayQueueSeconds, double engineQueueSeconds,
                                 double execSeconds) {
        double totalQueue = Math.max(0.0, gatewayQueueSeconds + engineQueueSeconds);
        String text = prompt == null ? "" : prompt.trim();
        String timings = "Queue: " + formatDuration(totalQueue) + ", generation: " + formatDuration(execSeconds);
        return text.isEmpty() ? timings : text + "\n\n" + timings;
    }

    static String formatDuration(double seconds) {
        double s = Math.max(0.0, seconds);
        if (s < 60) {
            if (s < 10) {
                return String.format(Locale.ROOT, "%.1f s", s);
            }
            return Math.round(s) + " s";
        }
        long minutes = (long) (s / 60);
        long restSeconds = Math.round(s - minutes * 60);
        if (s < 3600) {
            if (restSeconds > 0 && restSeconds < 60) {
                return minutes + " min " + restSeconds + " s";
            }
            return minutes + " min";
        }
        long hours = (long) (s / 3600);
        long restMinutes = (long) ((s - hours * 3600) / 60);
        if (restMinutes > 0) {
            return hours + " h " + restMinutes + " min";
        }
        return hours + " h";
    }
}
