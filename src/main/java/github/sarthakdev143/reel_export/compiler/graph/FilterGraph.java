package github.sarthakdev143.reel_export.compiler.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ordered set of filter chains. Serializes to the encoder's {@code -filter_complex} syntax.
 */
public record FilterGraph(List<FilterChain> chains) {

    public FilterGraph {
        chains = chains == null ? List.of() : List.copyOf(chains);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String serialize() {
        return chains.stream().map(FilterChain::serialize).collect(Collectors.joining(";"));
    }

    public boolean hasOutput(StreamLabel label) {
        return chains.stream().anyMatch(chain -> chain.outputs().contains(label));
    }

    /**
     * All filters in chain order, useful for inspecting what a graph does without parsing text.
     */
    public List<Filter> filters() {
        return chains.stream().flatMap(chain -> chain.filters().stream()).collect(Collectors.toList());
    }

    public List<Filter> filtersNamed(String name) {
        return filters().stream().filter(filter -> filter.name().equals(name)).collect(Collectors.toList());
    }

    public static final class Builder {

        private final List<FilterChain> chains = new ArrayList<>();
        private final Set<StreamLabel> produced = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder add(FilterChain chain) {
            for (StreamLabel output : chain.outputs()) {
                if (!produced.add(output)) {
                    throw new IllegalStateException("Stream label " + output + " is produced twice.");
                }
            }
            chains.add(chain);
            return this;
        }

        public FilterGraph build() {
            return new FilterGraph(chains);
        }
    }
}
