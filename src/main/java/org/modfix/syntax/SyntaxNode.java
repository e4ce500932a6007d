package org.modfix.syntax;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * An immutable interior node. Every "modification" returns a new node that shares all untouched children with this
 * one, so older trees stay valid after an edit.
 */
public final class SyntaxNode implements SyntaxElement {
    public final NodeKind kind;
    private final ImmutableList<SyntaxElement> children;
    private final int fullWidth;

    public SyntaxNode(NodeKind kind, List<? extends SyntaxElement> children) {
        this.kind = checkNotNull(kind);
        this.children = ImmutableList.copyOf(children);
        var width = 0;
        for (var c : this.children) width += c.fullWidth();
        this.fullWidth = width;
    }

    public ImmutableList<SyntaxElement> children() {
        return children;
    }

    public SyntaxElement child(int index) {
        checkElementIndex(index, children.size());
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public SyntaxNode withChild(int index, SyntaxElement replacement) {
        checkElementIndex(index, children.size());
        checkNotNull(replacement);
        if (children.get(index) == replacement) return this;
        var copy = new ArrayList<SyntaxElement>(children);
        copy.set(index, replacement);
        return new SyntaxNode(kind, copy);
    }

    public SyntaxNode withoutChild(int index) {
        checkElementIndex(index, children.size());
        var copy = new ArrayList<SyntaxElement>(children);
        copy.remove(index);
        return new SyntaxNode(kind, copy);
    }

    /** Index of the first child node of {@code kind}, or -1 */
    public int indexOfChild(NodeKind kind) {
        for (var i = 0; i < children.size(); i++) {
            var c = children.get(i);
            if (c instanceof SyntaxNode && ((SyntaxNode) c).kind == kind) return i;
        }
        return -1;
    }

    public Optional<SyntaxNode> childOfKind(NodeKind kind) {
        var i = indexOfChild(kind);
        if (i == -1) return Optional.empty();
        return Optional.of((SyntaxNode) children.get(i));
    }

    /** All tokens below this node, in source order */
    public Stream<SyntaxToken> tokens() {
        return children.stream()
                .flatMap(
                        c -> {
                            if (c instanceof SyntaxToken) return Stream.of((SyntaxToken) c);
                            return ((SyntaxNode) c).tokens();
                        });
    }

    @Override
    public int fullWidth() {
        return fullWidth;
    }

    @Override
    public void writeTo(StringBuilder out) {
        for (var c : children) c.writeTo(out);
    }

    @Override
    public String toString() {
        return kind + "`" + toFullString() + "`";
    }
}
