package org.modfix.rewrite;

import java.util.Optional;
import org.modfix.syntax.NodeKind;
import org.modfix.syntax.SyntaxNode;
import org.modfix.syntax.SyntaxPath;
import org.modfix.syntax.SyntaxToken;
import org.modfix.syntax.TokenKind;

/** Looks up the first modifier of a given kind on a declaration. */
class FindModifier {
    static Optional<SyntaxPath> in(SyntaxPath declaration, TokenKind kind) {
        var list = declaration.node().indexOfChild(NodeKind.MODIFIER_LIST);
        if (list == -1) return Optional.empty();
        var modifiers = declaration.child(list);
        var i = indexIn(modifiers.node(), kind);
        if (i == -1) return Optional.empty();
        return Optional.of(modifiers.child(i));
    }

    static int indexIn(SyntaxNode modifiers, TokenKind kind) {
        for (var i = 0; i < modifiers.childCount(); i++) {
            var c = modifiers.child(i);
            if (c instanceof SyntaxToken && ((SyntaxToken) c).kind == kind) return i;
        }
        return -1;
    }
}
