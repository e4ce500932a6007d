package org.modfix.rewrite;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import java.util.logging.Logger;
import org.modfix.syntax.NodeKind;
import org.modfix.syntax.SourceText;
import org.modfix.syntax.SyntaxNode;
import org.modfix.syntax.SyntaxPath;
import org.modfix.syntax.TokenKind;

/** Removes one modifier from a declaration and reflows the trivia around it. */
public class RemoveModifier {
    final TokenKind kind;

    public RemoveModifier(TokenKind kind) {
        this.kind = checkNotNull(kind);
    }

    /** Finds the declaration around {@code spanStart} and its modifier, if it has one. */
    public Optional<EditDescriptor> locate(SyntaxNode root, int spanStart) {
        var token = SyntaxPath.root(root).findToken(spanStart);
        if (!token.isPresent()) {
            LOG.fine(String.format("No token at %d", spanStart));
            return Optional.empty();
        }
        var declaration = token.get().enclosingDeclaration();
        if (!declaration.isPresent()) {
            LOG.fine(String.format("%s is not inside a declaration", token.get()));
            return Optional.empty();
        }
        return FindModifier.in(declaration.get(), kind).map(m -> new EditDescriptor(m, declaration.get()));
    }

    /**
     * Computes the replacements that remove the modifier described by {@code descriptor}. {@code text} is the text
     * the descriptor's tree was parsed from.
     */
    public ImmutableList<NodeReplacement> replacements(EditDescriptor descriptor, SourceText text) {
        // Look the modifier up again rather than trusting descriptor.targetToken
        var found = FindModifier.in(descriptor.declaration, kind);
        if (!found.isPresent()) {
            LOG.fine(String.format("%s has no `%s` modifier", descriptor.declaration, kind.text));
            return ImmutableList.of();
        }
        var modifier = found.get();
        var token = modifier.token();
        var result = ImmutableList.<NodeReplacement>builder();
        if (token.hasLeadingTrivia() || token.hasTrailingTrivia()) {
            var firstOnLine = LineBoundary.isFirstTokenOnLine(modifier, text);
            var moved = MoveTrivia.reflow(modifier.previousToken(), modifier, modifier.nextToken(), firstOnLine);
            for (var entry : moved.entrySet()) {
                result.add(NodeReplacement.ofToken(entry.getKey(), entry.getValue()));
            }
        }
        result.add(NodeReplacement.ofNode(descriptor.declaration, this::removeFrom, "remove `" + kind.text + "`"));
        return result.build();
    }

    /** Removes the first modifier of {@link #kind} from the current version of a declaration. */
    SyntaxNode removeFrom(SyntaxNode declaration) {
        var list = declaration.indexOfChild(NodeKind.MODIFIER_LIST);
        if (list == -1) return declaration;
        var modifiers = (SyntaxNode) declaration.child(list);
        var i = FindModifier.indexIn(modifiers, kind);
        if (i == -1) return declaration;
        return declaration.withChild(list, modifiers.withoutChild(i));
    }

    /** Removes a single modifier. */
    public SyntaxNode apply(SyntaxNode root, SourceText text, EditDescriptor descriptor) {
        var editor = new SyntaxEditor(root);
        editor.addAll(replacements(descriptor, text));
        return editor.getChangedRoot();
    }

    private static final Logger LOG = Logger.getLogger("main");
}
