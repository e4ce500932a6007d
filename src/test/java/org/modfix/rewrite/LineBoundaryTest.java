package org.modfix.rewrite;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.junit.Test;
import org.modfix.syntax.Parser;
import org.modfix.syntax.SourceText;
import org.modfix.syntax.SyntaxPath;

public class LineBoundaryTest {
    private static boolean firstOnLine(String text, String at) {
        var token = SyntaxPath.root(Parser.parse(text)).findToken(text.indexOf(at)).get();
        return LineBoundary.isFirstTokenOnLine(token, SourceText.of(text));
    }

    @Test
    public void indented() {
        var text = "class C {\n    new void M() { }\n}";
        assertThat(firstOnLine(text, "new"), equalTo(true));
        assertThat(firstOnLine(text, "void"), equalTo(false));
        assertThat(firstOnLine(text, "class"), equalTo(true));
    }

    @Test
    public void commentBeforeOnSameLine() {
        assertThat(firstOnLine("/* a */ new int x;", "new"), equalTo(true));
        assertThat(firstOnLine("x; /* a */ new int y;", "new"), equalTo(false));
    }

    @Test
    public void afterBlankLines() {
        assertThat(firstOnLine("x;\n\n\n\tnew int y;", "new"), equalTo(true));
    }
}
