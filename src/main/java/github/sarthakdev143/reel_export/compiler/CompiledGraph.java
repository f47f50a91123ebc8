package github.sarthakdev143.reel_export.compiler;

import github.sarthakdev143.reel_export.compiler.graph.FilterGraph;
import github.sarthakdev143.reel_export.compiler.graph.StreamLabel;

import java.util.List;

/**
 * Everything the render executor needs: encoder inputs, the filter graph, the ports to map and the
 * expected output duration used to turn encoder time marks into a percentage.
 * {@code audioOutput} is null when the graph produces no audio.
 */
public record CompiledGraph(
        List<GraphInput> inputs,
        FilterGraph filterGraph,
        StreamLabel videoOutput,
        StreamLabel audioOutput,
        double durationSec,
        List<ChainBoundary> boundaries) {

    public CompiledGraph {
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        boundaries = boundaries == null ? List.of() : List.copyOf(boundaries);
    }

    public String filterComplex() {
        return filterGraph.serialize();
    }
}
