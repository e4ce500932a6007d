package org.modfix.rewrite;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import org.modfix.syntax.SyntaxNode;
import org.modfix.syntax.SyntaxPath;
import org.modfix.syntax.SyntaxToken;

/**
 * A pending change to one node of an original tree. The change is a function of the node's current version, which
 * includes every change already made below it and any replacement queued earlier for the same node.
 */
public final class NodeReplacement {
    public final SyntaxPath target;
    private final UnaryOperator<SyntaxNode> compute;
    private final String description;

    private NodeReplacement(SyntaxPath target, UnaryOperator<SyntaxNode> compute, String description) {
        checkArgument(!target.isToken(), "%s is a token, replace its parent instead", target);
        this.target = target;
        this.compute = checkNotNull(compute);
        this.description = description;
    }

    public static NodeReplacement ofNode(SyntaxPath target, UnaryOperator<SyntaxNode> compute, String description) {
        return new NodeReplacement(target, compute, description);
    }

    /**
     * Substitutes {@code replacement} for {@code token} in the token's parent. If the slot no longer holds a token of
     * the same kind when the replacement runs, the parent is left alone.
     */
    public static NodeReplacement ofToken(SyntaxPath token, SyntaxToken replacement) {
        checkArgument(token.isToken(), "%s is not a token", token);
        checkNotNull(token.parent(), "%s has no parent", token);
        checkNotNull(replacement);
        var index = token.index();
        var kind = token.token().kind;
        UnaryOperator<SyntaxNode> swap =
                current -> {
                    if (index < current.childCount()
                            && current.child(index) instanceof SyntaxToken
                            && ((SyntaxToken) current.child(index)).kind == kind) {
                        return current.withChild(index, replacement);
                    }
                    LOG.fine(String.format("Skipped replacing %s, slot %d of %s has changed", token, index, current.kind));
                    return current;
                };
        return new NodeReplacement(token.parent(), swap, "replace " + token);
    }

    SyntaxNode applyTo(SyntaxNode current) {
        return checkNotNull(compute.apply(current), "%s produced null", this);
    }

    @Override
    public String toString() {
        return description + " in " + target;
    }

    private static final Logger LOG = Logger.getLogger("main");
}
