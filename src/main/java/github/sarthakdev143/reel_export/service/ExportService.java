package github.sarthakdev143.reel_export.service;

import github.sarthakdev143.reel_export.model.ContainerFormat;
import github.sarthakdev143.reel_export.model.timeline.Timeline;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

public interface ExportService {

    /**
     * Stores the uploaded media in a job workspace and starts rendering the timeline in the background.
     *
     * @param mediaFiles uploaded files; each file's original filename is the media id clips refer to
     * @return the export job id
     */
    String submitExport(Timeline timeline, List<MultipartFile> mediaFiles, String filename, ContainerFormat format)
            throws IOException;
}
