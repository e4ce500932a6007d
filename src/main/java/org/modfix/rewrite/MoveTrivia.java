package org.modfix.rewrite;

import static org.modfix.rewrite.CollapseWhitespace.collapse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.modfix.syntax.SyntaxPath;
import org.modfix.syntax.SyntaxToken;
import org.modfix.syntax.Trivia;

/** Decides where the trivia of a token that is about to be deleted goes. */
class MoveTrivia {
    /**
     * Returns the neighbors whose trivia changes, with their new versions.
     *
     * <p>A token that starts its line hands its trivia forward to the next token, so the previous line keeps its line
     * break. A token in the middle of a line merges its trivia into the gap between its neighbors. The merged run is
     * split at its first line break so that the previous token's trailing trivia still ends at a line break and the
     * next token's old leading trivia is not kept a second time.
     */
    static ImmutableMap<SyntaxPath, SyntaxToken> reflow(
            Optional<SyntaxPath> previous, SyntaxPath target, Optional<SyntaxPath> next, boolean firstOnLine) {
        var own = target.token().allTrivia();
        if (own.isEmpty()) return ImmutableMap.of();

        if (next.isPresent() && (firstOnLine || !previous.isPresent())) {
            var nextToken = next.get().token();
            var leading = collapse(concat(own, nextToken.leadingTrivia));
            return ImmutableMap.of(next.get(), nextToken.withLeadingTrivia(leading));
        }
        if (!previous.isPresent()) return ImmutableMap.of();

        var previousToken = previous.get().token();
        var run = new ArrayList<Trivia>(previousToken.trailingTrivia);
        run.addAll(own);
        if (!next.isPresent()) {
            return ImmutableMap.of(previous.get(), previousToken.withTrailingTrivia(collapse(run)));
        }
        var nextToken = next.get().token();
        run.addAll(nextToken.leadingTrivia);
        var merged = collapse(run);
        var split = afterFirstLineBreak(merged);
        return ImmutableMap.of(
                previous.get(), previousToken.withTrailingTrivia(merged.subList(0, split)),
                next.get(), nextToken.withLeadingTrivia(merged.subList(split, merged.size())));
    }

    private static List<Trivia> concat(List<Trivia> first, List<Trivia> second) {
        return ImmutableList.<Trivia>builder().addAll(first).addAll(second).build();
    }

    private static int afterFirstLineBreak(List<Trivia> trivia) {
        for (var i = 0; i < trivia.size(); i++) {
            if (trivia.get(i).isEndOfLine()) return i + 1;
        }
        return trivia.size();
    }
}
