package org.modfix.syntax;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;

import java.util.ArrayList;

/**
 * The immutable text of a document. Line starts are computed on first use; lines end with {@code \n}, {@code \r\n}
 * or {@code \r}. Lines and characters are zero-based, like LSP positions.
 */
public final class SourceText {
    private final String content;
    private int[] lineStarts;

    private SourceText(String content) {
        this.content = checkNotNull(content);
    }

    public static SourceText of(String content) {
        return new SourceText(content);
    }

    public int length() {
        return content.length();
    }

    public char charAt(int offset) {
        return content.charAt(offset);
    }

    public String substring(int start, int end) {
        return content.substring(start, end);
    }

    private synchronized int[] lineStarts() {
        if (lineStarts == null) {
            var starts = new ArrayList<Integer>();
            starts.add(0);
            for (var i = 0; i < content.length(); i++) {
                var c = content.charAt(i);
                if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
                    i++;
                    starts.add(i + 1);
                } else if (c == '\r' || c == '\n') {
                    starts.add(i + 1);
                }
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }
        return lineStarts;
    }

    public int lineCount() {
        return lineStarts().length;
    }

    /** The line containing {@code offset}. An offset that sits on a line break belongs to the line it ends. */
    public int lineOf(int offset) {
        checkPositionIndex(offset, content.length());
        var starts = lineStarts();
        var lo = 0;
        var hi = starts.length - 1;
        while (lo < hi) {
            var mid = (lo + hi + 1) >>> 1;
            if (starts[mid] <= offset) lo = mid;
            else hi = mid - 1;
        }
        return lo;
    }

    public int lineStart(int line) {
        return lineStarts()[line];
    }

    /** Start of the line containing {@code offset} */
    public int lineStartOf(int offset) {
        return lineStart(lineOf(offset));
    }

    public int characterOf(int offset) {
        return offset - lineStartOf(offset);
    }

    /** Converts a position to an offset, clamping lines and characters that point past the end. */
    public int offsetOf(int line, int character) {
        var starts = lineStarts();
        if (line < 0) return 0;
        if (line >= starts.length) return content.length();
        var start = starts[line];
        var end = line + 1 < starts.length ? starts[line + 1] : content.length();
        // Don't run into the line break
        while (end > start && isLineBreak(content.charAt(end - 1))) end--;
        return Math.min(start + Math.max(character, 0), end);
    }

    public static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    public static boolean isHorizontalWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B';
    }

    @Override
    public String toString() {
        return content;
    }
}
