package org.modfix.rewrite;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.modfix.syntax.Trivia;

class CollapseWhitespace {
    /** Drops every whitespace trivia that directly follows another whitespace trivia. */
    static ImmutableList<Trivia> collapse(List<Trivia> trivia) {
        var result = ImmutableList.<Trivia>builder();
        Trivia previous = null;
        for (var current : trivia) {
            if (!(previous != null && previous.isWhitespace() && current.isWhitespace())) {
                result.add(current);
            }
            previous = current;
        }
        return result.build();
    }
}
