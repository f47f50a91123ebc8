package github.sarthakdev143.reel_export.model;

import java.util.Locale;
import java.util.regex.Pattern;

public enum MediaKind {
    VIDEO,
    AUDIO,
    IMAGE;

    private static final Pattern IMAGE_EXTENSION = Pattern.compile(".*\\.(jpg|jpeg|png|webp|bmp|gif)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern AUDIO_EXTENSION = Pattern.compile(".*\\.(mp3|wav|aac|m4a|ogg|flac)$", Pattern.CASE_INSENSITIVE);

    /**
     * Classifies an uploaded file, preferring its content type and falling back to the file name.
     */
    public static MediaKind detect(String filename, String contentType) {
        String normalizedType = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        if (normalizedType.startsWith("image/")) {
            return IMAGE;
        }
        if (normalizedType.startsWith("audio/")) {
            return AUDIO;
        }
        if (normalizedType.startsWith("video/")) {
            return VIDEO;
        }

        String name = filename == null ? "" : filename;
        if (IMAGE_EXTENSION.matcher(name).matches()) {
            return IMAGE;
        }
        if (AUDIO_EXTENSION.matcher(name).matches()) {
            return AUDIO;
        }
        return VIDEO;
    }
}
