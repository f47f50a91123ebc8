package github.sarthakdev143.reel_export.dto;

public record CacheStatusResponse(
        boolean hasCache,
        int fileCount) {
}
