package org.modfix.rewrite;

import org.modfix.syntax.SourceText;
import org.modfix.syntax.SyntaxPath;

class LineBoundary {
    /**
     * True if only horizontal whitespace sits between the start of the token's line and the start of its leading
     * trivia. {@code text} must be the text {@code token} was parsed from.
     */
    static boolean isFirstTokenOnLine(SyntaxPath token, SourceText text) {
        var fullStart = token.position();
        for (var i = text.lineStartOf(fullStart); i < fullStart; i++) {
            if (!SourceText.isHorizontalWhitespace(text.charAt(i))) return false;
        }
        return true;
    }
}
