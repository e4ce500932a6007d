package org.modfix.rewrite;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import java.util.stream.Collectors;
import org.junit.Test;
import org.modfix.syntax.NodeKind;
import org.modfix.syntax.Parser;
import org.modfix.syntax.SourceText;
import org.modfix.syntax.SyntaxNode;
import org.modfix.syntax.TokenKind;

public class RemoveModifierTest {
    final RemoveModifier removeNew = new RemoveModifier(TokenKind.NEW);

    /** Removes `new` from the declaration around the first occurrence of {@code at} */
    private String fix(String text, String at) {
        var root = Parser.parse(text);
        var site = removeNew.locate(root, text.indexOf(at)).get();
        return removeNew.apply(root, SourceText.of(text), site).toFullString();
    }

    @Test
    public void firstOnLine() {
        assertThat(fix("    new void M() { }\n", "M"), equalTo("    void M() { }\n"));
    }

    @Test
    public void afterAnotherModifier() {
        assertThat(fix("public new void M() { }\n", "M"), equalTo("public void M() { }\n"));
    }

    @Test
    public void lastOnLine() {
        var text = "class C {\n    public new\n        void M() { }\n}\n";
        assertThat(fix(text, "M"), equalTo("class C {\n    public \n        void M() { }\n}\n"));
    }

    @Test
    public void insideType() {
        var text = "class C {\n    new int x;\n    new void M() { }\n}\n";
        assertThat(fix(text, "M"), equalTo("class C {\n    new int x;\n    void M() { }\n}\n"));
    }

    @Test
    public void keepsLeadingComment() {
        assertThat(fix("    /* hides */ new void M() { }\n", "M"), equalTo("    /* hides */ void M() { }\n"));
    }

    @Test
    public void keepsCommentOnPreviousLine() {
        var text = "class C {\n    // hides Base.M\n    new void M() { }\n}\n";
        assertThat(fix(text, "M("), equalTo("class C {\n    // hides Base.M\n    void M() { }\n}\n"));
    }

    @Test
    public void keepsTrailingComment() {
        assertThat(fix("public new /* x */ void M() { }\n", "M"), equalTo("public /* x */ void M() { }\n"));
    }

    @Test
    public void keepsCrlf() {
        var text = "class C {\r\n    new int x;\r\n}\r\n";
        assertThat(fix(text, "x"), equalTo("class C {\r\n    int x;\r\n}\r\n"));
    }

    @Test
    public void memberAfterGenericMethod() {
        var text = "class C {\n    public new void M<T>() { }\n    public new void N() { }\n}\n";
        assertThat(fix(text, "N("), equalTo("class C {\n    public new void M<T>() { }\n    public void N() { }\n}\n"));
        assertThat(fix(text, "M<"), equalTo("class C {\n    public void M<T>() { }\n    public new void N() { }\n}\n"));
    }

    @Test
    public void memberAfterIndexer() {
        var text = "class C {\n    public new int this[int i] { get { return i; } }\n    public new void N() { }\n}\n";
        assertThat(
                fix(text, "N("),
                equalTo("class C {\n    public new int this[int i] { get { return i; } }\n    public void N() { }\n}\n"));
        assertThat(
                fix(text, "this"),
                equalTo("class C {\n    public int this[int i] { get { return i; } }\n    public new void N() { }\n}\n"));
    }

    @Test
    public void attributedMember() {
        assertThat(
                fix("class C {\n    [Obsolete] public new void N() { }\n}\n", "N("),
                equalTo("class C {\n    [Obsolete] public void N() { }\n}\n"));
        assertThat(
                fix("class C {\n    [Obsolete]\n    new void N() { }\n}\n", "N("),
                equalTo("class C {\n    [Obsolete]\n    void N() { }\n}\n"));
    }

    @Test
    public void modifierCountShrinksByOne() {
        var text = "public static new readonly int x;";
        var root = Parser.parse(text);
        var site = removeNew.locate(root, text.indexOf("x")).get();
        var fixed = removeNew.apply(root, SourceText.of(text), site);

        var field = (SyntaxNode) fixed.child(0);
        assertThat(field.kind, equalTo(NodeKind.FIELD_DECLARATION));
        var modifiers = field.childOfKind(NodeKind.MODIFIER_LIST).get().tokens().map(t -> t.kind).collect(Collectors.toList());
        assertThat(modifiers, contains(TokenKind.PUBLIC, TokenKind.STATIC, TokenKind.READONLY));
        assertThat(fixed.toFullString(), equalTo("public static readonly int x;"));
    }

    @Test
    public void originalTreeIsUnchanged() {
        var text = "public new void M() { }\n";
        var root = Parser.parse(text);
        var site = removeNew.locate(root, 0).get();
        removeNew.apply(root, SourceText.of(text), site);
        assertThat(root.toFullString(), equalTo(text));
    }

    @Test
    public void locateFromAnyTokenInDeclaration() {
        var text = "public new void M() { }\n";
        var root = Parser.parse(text);
        for (var at : new String[] {"public", "void", "M", "{"}) {
            var site = removeNew.locate(root, text.indexOf(at)).get();
            assertThat(site.targetToken.token().kind, equalTo(TokenKind.NEW));
            assertThat(site.declaration.node().kind, equalTo(NodeKind.METHOD_DECLARATION));
        }
    }

    @Test
    public void locateInnermostDeclaration() {
        var text = "new class C {\n    new void M() { }\n}\n";
        var root = Parser.parse(text);
        var inner = removeNew.locate(root, text.indexOf("M")).get();
        assertThat(inner.declaration.node().kind, equalTo(NodeKind.METHOD_DECLARATION));
        var outer = removeNew.locate(root, text.indexOf("C")).get();
        assertThat(outer.declaration.node().kind, equalTo(NodeKind.TYPE_DECLARATION));
    }

    @Test
    public void locateWithoutModifier() {
        var text = "public void M() { }\n";
        assertThat(removeNew.locate(Parser.parse(text), text.indexOf("M")).isPresent(), equalTo(false));
    }

    @Test
    public void locateOutsideDeclaration() {
        var text = "; ; new\n";
        assertThat(removeNew.locate(Parser.parse(text), text.indexOf("new")).isPresent(), equalTo(false));
    }

    @Test
    public void removeFromIsIdempotent() {
        var text = "new void M() { }\n";
        var root = Parser.parse(text);
        var site = removeNew.locate(root, 0).get();
        var withoutNew = removeNew.removeFrom(site.declaration.node());
        assertThat(FindModifier.indexIn(withoutNew.childOfKind(NodeKind.MODIFIER_LIST).get(), TokenKind.NEW), equalTo(-1));
        assertThat(removeNew.removeFrom(withoutNew), sameInstance(withoutNew));
    }
}
