package org.modfix.syntax;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * SyntaxPath locates an element inside one particular root, the way a TreePath does for javac trees. Nodes and tokens
 * don't know their parents or offsets, so all navigation goes through paths.
 */
public final class SyntaxPath {
    private final SyntaxPath parent;
    private final SyntaxElement leaf;
    private final int index, position;

    private SyntaxPath(SyntaxPath parent, SyntaxElement leaf, int index, int position) {
        this.parent = parent;
        this.leaf = checkNotNull(leaf);
        this.index = index;
        this.position = position;
    }

    public static SyntaxPath root(SyntaxNode root) {
        return new SyntaxPath(null, root, -1, 0);
    }

    /** Null for the root */
    public SyntaxPath parent() {
        return parent;
    }

    public SyntaxElement leaf() {
        return leaf;
    }

    /** Index in the parent's children, -1 for the root */
    public int index() {
        return index;
    }

    /** Offset where this element's leading trivia starts */
    public int position() {
        return position;
    }

    public int end() {
        return position + leaf.fullWidth();
    }

    public boolean isToken() {
        return leaf instanceof SyntaxToken;
    }

    public SyntaxToken token() {
        return (SyntaxToken) leaf;
    }

    public SyntaxNode node() {
        return (SyntaxNode) leaf;
    }

    /** Offset of the token's text, after its leading trivia */
    public int spanStart() {
        if (isToken()) return position + token().leadingWidth();
        return firstToken().map(SyntaxPath::spanStart).orElse(position);
    }

    public SyntaxPath root() {
        var p = this;
        while (p.parent != null) p = p.parent;
        return p;
    }

    public SyntaxPath child(int i) {
        var node = node();
        var offset = position;
        for (var j = 0; j < i; j++) offset += node.child(j).fullWidth();
        return new SyntaxPath(this, node.child(i), i, offset);
    }

    /** Child indices from the root down to this element */
    public ImmutableList<Integer> indices() {
        var reversed = new ArrayList<Integer>();
        for (var p = this; p.parent != null; p = p.parent) reversed.add(p.index);
        var builder = ImmutableList.<Integer>builder();
        for (var i = reversed.size() - 1; i >= 0; i--) builder.add(reversed.get(i));
        return builder.build();
    }

    /**
     * The token whose full span, trivia included, contains {@code offset}. The end of the document resolves to the
     * END_OF_FILE token.
     */
    public Optional<SyntaxPath> findToken(int offset) {
        if (offset < position || offset > end()) return Optional.empty();
        var p = this;
        while (!p.isToken()) {
            var node = p.node();
            if (node.childCount() == 0) return Optional.empty();
            var start = p.position;
            SyntaxPath found = null;
            for (var i = 0; i < node.childCount(); i++) {
                var width = node.child(i).fullWidth();
                if (width > 0 && offset < start + width) {
                    found = new SyntaxPath(p, node.child(i), i, start);
                    break;
                }
                start += width;
            }
            if (found == null) {
                // Offset is at the very end
                return p.lastToken();
            }
            p = found;
        }
        return Optional.of(p);
    }

    public Optional<SyntaxPath> firstToken() {
        if (isToken()) return Optional.of(this);
        var node = node();
        for (var i = 0; i < node.childCount(); i++) {
            var found = child(i).firstToken();
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    public Optional<SyntaxPath> lastToken() {
        if (isToken()) return Optional.of(this);
        var node = node();
        for (var i = node.childCount() - 1; i >= 0; i--) {
            var found = child(i).lastToken();
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /** The token before this element in tree order */
    public Optional<SyntaxPath> previousToken() {
        for (var p = this; p.parent != null; p = p.parent) {
            for (var i = p.index - 1; i >= 0; i--) {
                var found = p.parent.child(i).lastToken();
                if (found.isPresent()) return found;
            }
        }
        return Optional.empty();
    }

    /** The token after this element in tree order */
    public Optional<SyntaxPath> nextToken() {
        for (var p = this; p.parent != null; p = p.parent) {
            var siblings = p.parent.node().childCount();
            for (var i = p.index + 1; i < siblings; i++) {
                var found = p.parent.child(i).firstToken();
                if (found.isPresent()) return found;
            }
        }
        return Optional.empty();
    }

    /** The nearest enclosing node, excluding this element, that matches {@code test} */
    public Optional<SyntaxPath> ancestor(Predicate<SyntaxNode> test) {
        for (var p = parent; p != null; p = p.parent) {
            if (test.test(p.node())) return Optional.of(p);
        }
        return Optional.empty();
    }

    public Optional<SyntaxPath> enclosingDeclaration() {
        return ancestor(n -> n.kind.isDeclaration());
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof SyntaxPath)) return false;
        var that = (SyntaxPath) other;
        return this.leaf == that.leaf
                && this.position == that.position
                && this.index == that.index
                && Objects.equals(this.parent, that.parent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(leaf), position, index);
    }

    @Override
    public String toString() {
        var what = isToken() ? token().kind + " `" + token().text + "`" : node().kind.toString();
        return what + " at " + position;
    }
}
