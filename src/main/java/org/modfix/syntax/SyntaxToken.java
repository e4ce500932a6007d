package org.modfix.syntax;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An immutable token with the trivia attached to it. Tokens compare by identity: two tokens with the same text at
 * different places in a tree are different tokens.
 */
public final class SyntaxToken implements SyntaxElement {
    public final TokenKind kind;
    public final String text;
    public final ImmutableList<Trivia> leadingTrivia, trailingTrivia;

    public SyntaxToken(TokenKind kind, String text, List<Trivia> leadingTrivia, List<Trivia> trailingTrivia) {
        this.kind = checkNotNull(kind);
        this.text = checkNotNull(text);
        this.leadingTrivia = ImmutableList.copyOf(leadingTrivia);
        this.trailingTrivia = ImmutableList.copyOf(trailingTrivia);
    }

    public static SyntaxToken of(TokenKind kind, String text) {
        return new SyntaxToken(kind, text, List.of(), List.of());
    }

    public SyntaxToken withLeadingTrivia(List<Trivia> trivia) {
        return new SyntaxToken(kind, text, trivia, trailingTrivia);
    }

    public SyntaxToken withTrailingTrivia(List<Trivia> trivia) {
        return new SyntaxToken(kind, text, leadingTrivia, trivia);
    }

    public boolean hasLeadingTrivia() {
        return !leadingTrivia.isEmpty();
    }

    public boolean hasTrailingTrivia() {
        return !trailingTrivia.isEmpty();
    }

    /** Leading trivia followed by trailing trivia. */
    public ImmutableList<Trivia> allTrivia() {
        return ImmutableList.<Trivia>builder().addAll(leadingTrivia).addAll(trailingTrivia).build();
    }

    public int leadingWidth() {
        return width(leadingTrivia);
    }

    public int trailingWidth() {
        return width(trailingTrivia);
    }

    private static int width(List<Trivia> trivia) {
        var total = 0;
        for (var t : trivia) total += t.width();
        return total;
    }

    @Override
    public int fullWidth() {
        return leadingWidth() + text.length() + trailingWidth();
    }

    @Override
    public void writeTo(StringBuilder out) {
        for (var t : leadingTrivia) out.append(t.text);
        out.append(text);
        for (var t : trailingTrivia) out.append(t.text);
    }

    @Override
    public String toString() {
        return kind == TokenKind.END_OF_FILE ? "<EOF>" : text;
    }
}
