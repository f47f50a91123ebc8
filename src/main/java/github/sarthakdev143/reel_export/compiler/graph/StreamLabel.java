package github.sarthakdev143.reel_export.compiler.graph;

/**
 * A named port in the filter graph. Input pads use the encoder's {@code <input>:<type>} form.
 */
public record StreamLabel(String name) {

    public StreamLabel {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stream label name must not be blank.");
        }
    }

    public static StreamLabel of(String name) {
        return new StreamLabel(name);
    }

    public static StreamLabel videoInput(int inputIndex) {
        return new StreamLabel(inputIndex + ":v");
    }

    public static StreamLabel audioInput(int inputIndex) {
        return new StreamLabel(inputIndex + ":a");
    }

    @Override
    public String toString() {
        return "[" + name + "]";
    }
}
