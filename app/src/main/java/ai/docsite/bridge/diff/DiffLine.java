package ai.docsite.bridge.diff;

import java.util.Objects;

/**
 * One line of a region diff.
 */
public record DiffLine(Type type, String text) {

    public enum Type {
        ADDED('+'),
        REMOVED('-'),
        CONTEXT(' ');

        private final char prefix;

        Type(char prefix) {
            this.prefix = prefix;
        }

        public char prefix() {
            return prefix;
        }
    }

    public DiffLine {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public String render() {
        return type.prefix() + text;
    }
}
