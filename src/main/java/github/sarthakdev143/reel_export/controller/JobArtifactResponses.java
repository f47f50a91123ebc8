package github.sarthakdev143.reel_export.controller;

import github.sarthakdev143.reel_export.model.JobState;
import github.sarthakdev143.reel_export.model.RenderJob;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;

import java.nio.file.Files;
import java.util.Optional;

/**
 * Builds the download response for a finished job's artifact.
 */
final class JobArtifactResponses {

    private JobArtifactResponses() {
    }

    static ResponseEntity<?> serve(Optional<RenderJob> job, boolean attachment, String notReadyMessage) {
        Optional<RenderJob> ready = job
                .filter(candidate -> candidate.state() == JobState.DONE)
                .filter(candidate -> candidate.outputPath() != null && Files.isRegularFile(candidate.outputPath()));
        if (ready.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(notReadyMessage);
        }

        RenderJob artifact = ready.get();
        FileSystemResource resource = new FileSystemResource(artifact.outputPath());
        ContentDisposition disposition = (attachment ? ContentDisposition.attachment() : ContentDisposition.inline())
                .filename(artifact.filename())
                .build();
        MediaType mediaType = MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(mediaType)
                .body(resource);
    }
}
