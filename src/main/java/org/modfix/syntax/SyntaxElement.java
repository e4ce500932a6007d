package org.modfix.syntax;

/** A child of a {@link SyntaxNode}: either another node or a token. */
public interface SyntaxElement {
    /** Width including leading and trailing trivia. */
    int fullWidth();

    void writeTo(StringBuilder out);

    default String toFullString() {
        var out = new StringBuilder(fullWidth());
        writeTo(out);
        return out.toString();
    }
}
