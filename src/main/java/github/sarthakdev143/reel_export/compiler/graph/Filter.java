package github.sarthakdev143.reel_export.compiler.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single filter with its ordered arguments. Instances are immutable; the option methods return copies.
 */
public record Filter(String name, List<FilterOption> options) {

    public Filter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Filter name must not be blank.");
        }
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static Filter named(String name) {
        return new Filter(name, List.of());
    }

    public Filter option(String key, String value) {
        List<FilterOption> extended = new ArrayList<>(options);
        extended.add(new FilterOption(key, value));
        return new Filter(name, extended);
    }

    public Filter option(String key, int value) {
        return option(key, Integer.toString(value));
    }

    public Filter positional(String value) {
        return option(null, value);
    }

    public String serialize() {
        if (options.isEmpty()) {
            return name;
        }
        return name + "=" + options.stream()
                .map(FilterOption::serialize)
                .collect(Collectors.joining(":"));
    }
}
