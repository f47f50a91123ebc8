package github.sarthakdev143.reel_export.compiler.graph;

/**
 * One filter argument. A null key marks a positional argument.
 */
public record FilterOption(String key, String value) {

    public FilterOption {
        if (value == null) {
            throw new IllegalArgumentException("Filter option value must not be null.");
        }
        // ':' separates options; the graph parser only strips one escape level, so it cannot be carried here.
        if (value.indexOf(':') >= 0) {
            throw new IllegalArgumentException("Filter option value must not contain ':': " + value);
        }
    }

    String serialize() {
        String escaped = escape(value);
        return key == null ? escaped : key + "=" + escaped;
    }

    static String escape(String raw) {
        StringBuilder escaped = new StringBuilder(raw.length());
        for (int index = 0; index < raw.length(); index++) {
            char character = raw.charAt(index);
            if (character == '\\' || character == ','
                    || character == ';' || character == '[' || character == ']') {
                escaped.append('\\');
            }
            escaped.append(character);
        }
        return escaped.toString();
    }
}
