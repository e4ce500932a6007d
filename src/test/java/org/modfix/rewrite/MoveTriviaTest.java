package org.modfix.rewrite;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.junit.Test;
import org.modfix.syntax.Parser;
import org.modfix.syntax.SourceText;
import org.modfix.syntax.SyntaxPath;
import org.modfix.syntax.Trivia;

public class MoveTriviaTest {
    private static SyntaxPath token(String text, String at) {
        return SyntaxPath.root(Parser.parse(text)).findToken(text.indexOf(at)).get();
    }

    private static boolean firstOnLine(SyntaxPath token, String text) {
        return LineBoundary.isFirstTokenOnLine(token, SourceText.of(text));
    }

    @Test
    public void firstOnLineMovesForward() {
        var text = "x;\n  new  int y;";
        var target = token(text, "new");
        var moved = MoveTrivia.reflow(target.previousToken(), target, target.nextToken(), firstOnLine(target, text));
        var next = target.nextToken().get();
        assertThat(moved.keySet(), contains(next));
        assertThat(moved.get(next).leadingTrivia, contains(Trivia.whitespace("  ")));
    }

    @Test
    public void midLineMovesBackward() {
        var text = "public new int y;";
        var target = token(text, "new");
        var moved = MoveTrivia.reflow(target.previousToken(), target, target.nextToken(), firstOnLine(target, text));
        var previous = target.previousToken().get();
        var next = target.nextToken().get();
        assertThat(moved.get(previous).trailingTrivia, contains(Trivia.whitespace(" ")));
        assertThat(moved.get(next).leadingTrivia, empty());
    }

    @Test
    public void splitsAtLineBreak() {
        var text = "public new\n    int y;";
        var target = token(text, "new");
        var moved = MoveTrivia.reflow(target.previousToken(), target, target.nextToken(), firstOnLine(target, text));
        var previous = target.previousToken().get();
        var next = target.nextToken().get();
        assertThat(moved.get(previous).trailingTrivia, contains(Trivia.whitespace(" "), Trivia.endOfLine("\n")));
        assertThat(moved.get(next).leadingTrivia, contains(Trivia.whitespace("    ")));
    }

    @Test
    public void firstTokenInFile() {
        var text = "/* a */ new int y;";
        var target = token(text, "new");
        assertThat(target.previousToken().isPresent(), equalTo(false));
        var moved = MoveTrivia.reflow(target.previousToken(), target, target.nextToken(), firstOnLine(target, text));
        var next = target.nextToken().get();
        assertThat(moved.get(next).toFullString(), equalTo("/* a */ int "));
    }

    @Test
    public void noTrivia() {
        var text = "x.new.y";
        var target = token(text, "new");
        var moved = MoveTrivia.reflow(target.previousToken(), target, target.nextToken(), firstOnLine(target, text));
        assertThat(moved.isEmpty(), equalTo(true));
    }
}
