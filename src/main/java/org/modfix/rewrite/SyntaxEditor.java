package org.modfix.rewrite;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import java.util.HashSet;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;
import org.modfix.syntax.SyntaxNode;
import org.modfix.syntax.SyntaxPath;
import org.modfix.syntax.SyntaxToken;

/**
 * Collects replacements against one original tree and produces the changed tree in a single bottom-up rewrite.
 * Children are rewritten before their parent, and replacements of the same node run in the order they were added.
 * Subtrees without replacements are shared with the original tree.
 */
public class SyntaxEditor {
    private final SyntaxNode original;
    private final ListMultimap<ImmutableList<Integer>, NodeReplacement> changes = ArrayListMultimap.create();
    /** Paths of replaced nodes and all their ancestors */
    private final Set<ImmutableList<Integer>> touched = new HashSet<>();

    public SyntaxEditor(SyntaxNode original) {
        this.original = checkNotNull(original);
    }

    public void replace(NodeReplacement replacement) {
        checkArgument(
                replacement.target.root().leaf() == original, "%s is not in the tree being edited", replacement);
        var key = replacement.target.indices();
        changes.put(key, replacement);
        for (var i = 0; i <= key.size(); i++) {
            touched.add(key.subList(0, i));
        }
    }

    public void replaceNode(SyntaxPath target, UnaryOperator<SyntaxNode> compute) {
        replace(NodeReplacement.ofNode(target, compute, "replace " + target));
    }

    public void replaceToken(SyntaxPath token, SyntaxToken replacement) {
        replace(NodeReplacement.ofToken(token, replacement));
    }

    public void addAll(Iterable<NodeReplacement> replacements) {
        for (var r : replacements) replace(r);
    }

    public boolean hasChanges() {
        return !changes.isEmpty();
    }

    public SyntaxNode getChangedRoot() {
        if (changes.isEmpty()) return original;
        var changed = rewrite(original, ImmutableList.of());
        LOG.fine(String.format("Applied %d replacements to %d nodes", changes.size(), changes.keySet().size()));
        return changed;
    }

    private SyntaxNode rewrite(SyntaxNode node, ImmutableList<Integer> path) {
        if (!touched.contains(path)) return node;
        var current = node;
        for (var i = 0; i < node.childCount(); i++) {
            var child = node.child(i);
            if (!(child instanceof SyntaxNode)) continue;
            var childPath = ImmutableList.<Integer>builder().addAll(path).add(i).build();
            var rewritten = rewrite((SyntaxNode) child, childPath);
            if (rewritten != child) current = current.withChild(i, rewritten);
        }
        for (var r : changes.get(path)) {
            current = r.applyTo(current);
        }
        return current;
    }

    private static final Logger LOG = Logger.getLogger("main");
}
