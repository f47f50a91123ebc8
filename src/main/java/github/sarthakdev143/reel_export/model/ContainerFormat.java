package github.sarthakdev143.reel_export.model;

import java.nio.file.Path;
import java.util.Locale;

public enum ContainerFormat {
    MP4(true),
    MOV(true),
    MKV(false);

    private final boolean supportsFastStart;

    ContainerFormat(boolean supportsFastStart) {
        this.supportsFastStart = supportsFastStart;
    }

    public static ContainerFormat fromInput(String input) {
        if (input == null || input.isBlank()) {
            return MP4;
        }

        try {
            return ContainerFormat.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("format must be one of mp4, mov, mkv.");
        }
    }

    public static ContainerFormat fromPath(Path path) {
        String name = path.getFileName().toString();
        int extensionIndex = name.lastIndexOf('.');
        if (extensionIndex < 0) {
            return MP4;
        }
        return fromInput(name.substring(extensionIndex + 1));
    }

    public boolean supportsFastStart() {
        return supportsFastStart;
    }

    public String extension() {
        return name().toLowerCase(Locale.ROOT);
    }
}
