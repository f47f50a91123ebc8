package github.sarthakdev143.reel_export.dto;

public record ClearCacheResponse(
        boolean success,
        int filesDeleted) {
}
