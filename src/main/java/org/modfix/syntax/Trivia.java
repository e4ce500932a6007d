package org.modfix.syntax;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** Whitespace, line breaks, comments and directives that sit between tokens. */
public final class Trivia {
    public final TriviaKind kind;
    public final String text;

    private Trivia(TriviaKind kind, String text) {
        this.kind = checkNotNull(kind);
        this.text = checkNotNull(text);
    }

    public static Trivia of(TriviaKind kind, String text) {
        return new Trivia(kind, text);
    }

    public static Trivia whitespace(String text) {
        return new Trivia(TriviaKind.WHITESPACE, text);
    }

    public static Trivia endOfLine(String text) {
        return new Trivia(TriviaKind.END_OF_LINE, text);
    }

    public static Trivia comment(String text) {
        return new Trivia(TriviaKind.COMMENT, text);
    }

    public boolean isWhitespace() {
        return kind == TriviaKind.WHITESPACE;
    }

    public boolean isEndOfLine() {
        return kind == TriviaKind.END_OF_LINE;
    }

    public int width() {
        return text.length();
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Trivia)) return false;
        var that = (Trivia) other;
        return this.kind == that.kind && this.text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text);
    }

    @Override
    public String toString() {
        return kind + "[" + text.replace("\r", "\\r").replace("\n", "\\n").replace("\t", "\\t") + "]";
    }
}
