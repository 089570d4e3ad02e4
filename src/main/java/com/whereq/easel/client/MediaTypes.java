package com.whereq.easel.client;

import com.whereq.easel.model.MediaKind;

import java.util.Locale;
import java.util.Map;

/**
 * Extension based MIME type guesses for engine artifacts and uploads
 */
public final class MediaTypes {

    public static final String OCTET_STREAM = "application/octet-stream";

    private static final Map<String, String> IMAGE = Map.of(
        "png", "image/png",
        "jpg", "image/jpeg",
        "jpeg", "image/jpeg",
        "webp", "image/webp",
        "bmp", "image/bmp",
        "tiff", "image/tiff",
        "tif", "image/tiff");

    // gif belongs here: animated outputs are delivered as video
    private static final Map<String, String> VIDEO = Map.of(
        "mp4", "video/mp4",
        "m4v", "video/mp4",
        "webm", "video/webm",
        "mov", "video/quicktime",
        "mkv", "video/x-matroska",
        "gif", "image/gif");

    private static final Map<String, String> AUDIO = Map.of(
        "flac", "audio/flac",
        "wav", "audio/wav",
        "mp3", "audio/mpeg",
        "m4a", "audio/aac",
        "aac", "audio/aac",
        "ogg", "audio/ogg",
        "oga", "audio/ogg");

    private MediaTypes() {
    }

    public static String guess(MediaKind kind, String filename) {
        Map<String, String> table = switch (kind) {
            case IMAGE -> IMAGE;
            case VIDEO -> VIDEO;
            case AUDIO -> AUDIO;
        };
        return table.getOrDefault(extension(filename), OCTET_STREAM);
    }

    /**
     * Content type declared for an input image upload; PNG unless the name says otherwise
     */
    public static String uploadContentType(String filename) {
        String ext = extension(filename);
        if (ext.equals("jpg") || ext.equals("jpeg")) {
            return "image/jpeg";
        }
        if (ext.equals("webp")) {
            return "image/webp";
        }
        return "image/png";
    }

    private static String extension(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
