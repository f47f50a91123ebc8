package github.sarthakdev143.reel_export.service;

import java.nio.file.Path;

/**
 * An uploaded file stored in a job workspace. {@code originalFilename} is the identifier clips refer to.
 */
public record UploadedMedia(
        String originalFilename,
        Path path,
        String contentType) {
}
