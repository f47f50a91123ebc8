package github.sarthakdev143.reel_export.compiler.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Linear chain of filters reading from {@code inputs} and writing to {@code outputs}.
 */
public record FilterChain(
        List<StreamLabel> inputs,
        List<Filter> filters,
        List<StreamLabel> outputs) {

    public FilterChain {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        if (filters == null || filters.isEmpty()) {
            throw new IllegalArgumentException("A filter chain needs at least one filter.");
        }
        filters = List.copyOf(filters);
    }

    public static FilterChain of(StreamLabel input, List<Filter> filters, StreamLabel output) {
        return new FilterChain(List.of(input), filters, List.of(output));
    }

    public static FilterChain of(List<StreamLabel> inputs, Filter filter, StreamLabel output) {
        return new FilterChain(inputs, List.of(filter), List.of(output));
    }

    /**
     * Source chain with no input pads, e.g. a generated silence.
     */
    public static FilterChain source(Filter filter, StreamLabel output) {
        return new FilterChain(List.of(), List.of(filter), List.of(output));
    }

    public String serialize() {
        String in = inputs.stream().map(StreamLabel::toString).collect(Collectors.joining());
        String body = filters.stream().map(Filter::serialize).collect(Collectors.joining(","));
        String out = outputs.stream().map(StreamLabel::toString).collect(Collectors.joining());
        return in + body + out;
    }
}
