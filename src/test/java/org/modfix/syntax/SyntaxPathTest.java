package org.modfix.syntax;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class SyntaxPathTest {
    static final String TEXT = "public new void M() { }\n";
    final SyntaxPath root = SyntaxPath.root(Parser.parse(TEXT));

    @Test
    public void findTokenAtText() {
        var found = root.findToken(7).get();
        assertThat(found.token().kind, equalTo(TokenKind.NEW));
        assertThat(found.spanStart(), equalTo(7));
        assertThat(found.indices(), contains(0, 0, 1));
    }

    @Test
    public void findTokenInTrivia() {
        // The space after `public` is its trailing trivia
        var found = root.findToken(6).get();
        assertThat(found.token().kind, equalTo(TokenKind.PUBLIC));
    }

    @Test
    public void findTokenAtEnd() {
        var found = root.findToken(TEXT.length()).get();
        assertThat(found.token().kind, equalTo(TokenKind.END_OF_FILE));
        assertThat(root.findToken(TEXT.length() + 1).isPresent(), equalTo(false));
    }

    @Test
    public void neighbors() {
        var modifier = root.findToken(7).get();
        assertThat(modifier.previousToken().get().token().kind, equalTo(TokenKind.PUBLIC));
        assertThat(modifier.nextToken().get().token().text, equalTo("void"));
        assertThat(root.firstToken().get().previousToken().isPresent(), equalTo(false));
        assertThat(root.lastToken().get().token().kind, equalTo(TokenKind.END_OF_FILE));
    }

    @Test
    public void enclosingDeclaration() {
        var name = root.findToken(16).get();
        assertThat(name.token().text, equalTo("M"));
        var declaration = name.enclosingDeclaration().get();
        assertThat(declaration.node().kind, equalTo(NodeKind.METHOD_DECLARATION));
        assertThat(declaration.position(), equalTo(0));
        assertThat(declaration.end(), equalTo(TEXT.length()));
    }

    @Test
    public void pathsAreValues() {
        assertThat(root.findToken(7).get(), equalTo(root.findToken(8).get()));
        assertThat(root.findToken(7).get(), not(equalTo(root.findToken(0).get())));
        assertThat(root.findToken(7).get().root(), equalTo(root));
    }
}
