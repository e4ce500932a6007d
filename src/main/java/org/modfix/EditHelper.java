package org.modfix;

import java.util.Optional;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.modfix.syntax.SourceText;

class EditHelper {
    /** A single edit that turns {@code before} into {@code after}, covering only the part that differs. */
    static Optional<TextEdit> replaceChanged(Document before, Document after) {
        var old = before.content();
        var changed = after.content();
        if (old.equals(changed)) return Optional.empty();

        var limit = Math.min(old.length(), changed.length());
        var prefix = 0;
        while (prefix < limit && old.charAt(prefix) == changed.charAt(prefix)) prefix++;
        var suffix = 0;
        while (suffix < limit - prefix
                && old.charAt(old.length() - 1 - suffix) == changed.charAt(changed.length() - 1 - suffix)) suffix++;
        // Don't split a \r\n
        if (splitsLineBreak(old, prefix)) prefix--;
        if (splitsLineBreak(old, old.length() - suffix)) suffix--;

        var start = position(before.text(), prefix);
        var end = position(before.text(), old.length() - suffix);
        var newText = changed.substring(prefix, changed.length() - suffix);
        return Optional.of(new TextEdit(new Range(start, end), newText));
    }

    private static boolean splitsLineBreak(String text, int offset) {
        return offset > 0 && offset < text.length() && text.charAt(offset - 1) == '\r' && text.charAt(offset) == '\n';
    }

    static Position position(SourceText text, int offset) {
        return new Position(text.lineOf(offset), text.characterOf(offset));
    }

    static int offset(SourceText text, Position position) {
        return text.offsetOf(position.getLine(), position.getCharacter());
    }
}
