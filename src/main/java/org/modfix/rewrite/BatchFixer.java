package org.modfix.rewrite;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.logging.Logger;
import org.modfix.syntax.SourceText;
import org.modfix.syntax.SyntaxNode;

/**
 * Applies one fix at many sites in a single rewrite. Every site's replacements are computed against the original tree
 * and queued into one {@link SyntaxEditor} in site order, so where two sites replace the same token the later site
 * wins, and everything else both sites change is kept.
 */
public class BatchFixer {
    private final RemoveModifier operation;

    public BatchFixer(RemoveModifier operation) {
        this.operation = checkNotNull(operation);
    }

    public SyntaxNode apply(SyntaxNode root, SourceText text, List<EditDescriptor> descriptors) {
        var editor = new SyntaxEditor(root);
        for (var d : descriptors) {
            editor.addAll(operation.replacements(d, text));
        }
        LOG.fine(String.format("Fixing %d sites", descriptors.size()));
        return editor.getChangedRoot();
    }

    private static final Logger LOG = Logger.getLogger("main");
}
