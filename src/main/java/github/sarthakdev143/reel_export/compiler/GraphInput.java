package github.sarthakdev143.reel_export.compiler;

import java.nio.file.Path;
import java.util.List;

/**
 * One encoder input; {@code options} are placed before its {@code -i}.
 */
public record GraphInput(Path path, List<String> options) {

    public GraphInput {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static GraphInput of(Path path) {
        return new GraphInput(path, List.of());
    }
}
