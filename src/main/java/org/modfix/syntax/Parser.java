package org.modfix.syntax;

import static org.modfix.syntax.TokenKind.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * A tolerant parser for member declarations. It recognizes enough structure to find declarations and their
 * modifiers; statement and expression bodies are kept as token groups. It never fails: anything it can't place ends
 * up in a SKIPPED node, so the tree always prints back to the exact input.
 */
public class Parser {
    private final List<SyntaxToken> tokens;
    private int index = 0;

    private Parser(List<SyntaxToken> tokens) {
        this.tokens = tokens;
    }

    public static SyntaxNode parse(String text) {
        var root = new Parser(Lexer.tokenize(text)).compilationUnit();
        LOG.fine(String.format("Parsed %d characters", root.fullWidth()));
        return root;
    }

    public static SyntaxNode parse(SourceText text) {
        return parse(text.toString());
    }

    private TokenKind peek() {
        return peek(0);
    }

    private TokenKind peek(int ahead) {
        var i = Math.min(index + ahead, tokens.size() - 1);
        return tokens.get(i).kind;
    }

    private SyntaxToken next() {
        var token = tokens.get(index);
        if (token.kind != END_OF_FILE) index++;
        return token;
    }

    private SyntaxNode compilationUnit() {
        var children = new ArrayList<SyntaxElement>();
        while (peek() != END_OF_FILE) {
            children.add(member(false));
        }
        children.add(next());
        return new SyntaxNode(NodeKind.COMPILATION_UNIT, children);
    }

    private SyntaxElement member(boolean inBody) {
        var prefix = new ArrayList<SyntaxElement>();
        while (peek() == OPEN_BRACKET) {
            prefix.add(group(NodeKind.ATTRIBUTE_LIST, OPEN_BRACKET, CLOSE_BRACKET));
        }
        var modifiers = modifiers();
        var kind = peek();
        if (kind.isTypeDeclarationKeyword()) return withBody(NodeKind.TYPE_DECLARATION, prefix, modifiers);
        if (kind == NAMESPACE) return withBody(NodeKind.NAMESPACE_DECLARATION, prefix, modifiers);
        if (kind == IDENTIFIER) return typedMember(prefix, modifiers);

        var skipped = prefix;
        if (modifiers.childCount() > 0) skipped.add(modifiers);
        var closesBody = inBody && kind == CLOSE_BRACE;
        if (kind != END_OF_FILE && !(closesBody && !skipped.isEmpty())) {
            skipped.add(next());
        }
        return new SyntaxNode(NodeKind.SKIPPED, skipped);
    }

    private SyntaxNode modifiers() {
        var modifiers = new ArrayList<SyntaxElement>();
        while (peek().isModifier) modifiers.add(next());
        return new SyntaxNode(NodeKind.MODIFIER_LIST, modifiers);
    }

    /** A type or namespace: keyword, header, then a body of members */
    private SyntaxNode withBody(NodeKind kind, List<SyntaxElement> attributes, SyntaxNode modifiers) {
        var children = new ArrayList<SyntaxElement>(attributes);
        children.add(modifiers);
        children.add(next());
        // Name, type parameters, base types, constraints
        while (!atAny(OPEN_BRACE, SEMICOLON, CLOSE_BRACE, END_OF_FILE)) {
            children.add(next());
        }
        if (peek() == OPEN_BRACE) {
            children.add(next());
            while (!atAny(CLOSE_BRACE, END_OF_FILE)) {
                children.add(member(true));
            }
            if (peek() == CLOSE_BRACE) children.add(next());
        }
        if (peek() == SEMICOLON) children.add(next());
        return new SyntaxNode(kind, children);
    }

    private SyntaxNode typedMember(List<SyntaxElement> attributes, SyntaxNode modifiers) {
        var children = new ArrayList<SyntaxElement>(attributes);
        children.add(modifiers);
        // Constructor
        if (peek(1) == OPEN_PAREN) {
            children.add(next());
            return methodRest(children);
        }
        children.add(type());
        if (peek() == IDENTIFIER) children.add(next());
        if (endsWithWord(children, "operator")) {
            // The operator symbol may be `=`, `<` or `[`, or a conversion's target type
            while (!atAny(OPEN_PAREN, OPEN_BRACE, SEMICOLON, CLOSE_BRACE, END_OF_FILE)) {
                children.add(next());
            }
        }
        // Rest of the name: explicit interface, type parameters, indexer parameters, more field names
        while (!atAny(OPEN_PAREN, OPEN_BRACE, EQUALS, SEMICOLON, CLOSE_BRACE, END_OF_FILE)) {
            if (peek() == LESS_THAN) children.add(group(NodeKind.TYPE_PARAMETER_LIST, LESS_THAN, GREATER_THAN));
            else if (peek() == OPEN_BRACKET) children.add(group(NodeKind.PARAMETER_LIST, OPEN_BRACKET, CLOSE_BRACKET));
            else children.add(next());
        }
        switch (peek()) {
            case OPEN_PAREN:
                return methodRest(children);
            case OPEN_BRACE:
                children.add(block());
                if (peek() == EQUALS) {
                    children.add(initializer());
                    if (peek() == SEMICOLON) children.add(next());
                }
                return new SyntaxNode(NodeKind.PROPERTY_DECLARATION, children);
            default:
                if (peek() == EQUALS) children.add(initializer());
                untilSemicolon(children);
                if (peek() == SEMICOLON) children.add(next());
                return new SyntaxNode(NodeKind.FIELD_DECLARATION, children);
        }
    }

    private static boolean endsWithWord(List<SyntaxElement> children, String word) {
        var last = children.get(children.size() - 1);
        return last instanceof SyntaxToken && ((SyntaxToken) last).text.equals(word);
    }

    private SyntaxNode methodRest(List<SyntaxElement> children) {
        children.add(group(NodeKind.PARAMETER_LIST, OPEN_PAREN, CLOSE_PAREN));
        // Constraints, throws clauses, expression bodies
        while (!atAny(OPEN_BRACE, SEMICOLON, CLOSE_BRACE, END_OF_FILE)) {
            children.add(next());
        }
        if (peek() == OPEN_BRACE) children.add(block());
        else if (peek() == SEMICOLON) children.add(next());
        return new SyntaxNode(NodeKind.METHOD_DECLARATION, children);
    }

    private SyntaxNode type() {
        var children = new ArrayList<SyntaxElement>();
        children.add(next());
        while (true) {
            if (peek() == DOT && peek(1) == IDENTIFIER) {
                children.add(next());
                children.add(next());
            } else if (peek() == LESS_THAN) {
                children.addAll(group(NodeKind.TYPE, LESS_THAN, GREATER_THAN).children());
            } else if (peek() == OPEN_BRACKET) {
                children.addAll(group(NodeKind.TYPE, OPEN_BRACKET, CLOSE_BRACKET).children());
            } else if (peek() == OPERATOR && isTypeSuffix(tokens.get(index).text)) {
                children.add(next());
            } else {
                break;
            }
        }
        return new SyntaxNode(NodeKind.TYPE, children);
    }

    private static boolean isTypeSuffix(String text) {
        return text.equals("?") || text.equals("*");
    }

    /** { ... } with nested blocks as child nodes */
    private SyntaxNode block() {
        var children = new ArrayList<SyntaxElement>();
        children.add(next());
        while (!atAny(CLOSE_BRACE, END_OF_FILE)) {
            if (peek() == OPEN_BRACE) children.add(block());
            else children.add(next());
        }
        if (peek() == CLOSE_BRACE) children.add(next());
        return new SyntaxNode(NodeKind.BLOCK, children);
    }

    private SyntaxNode group(NodeKind kind, TokenKind open, TokenKind close) {
        var children = new ArrayList<SyntaxElement>();
        children.add(next());
        var depth = 1;
        while (depth > 0 && peek() != END_OF_FILE) {
            var token = next();
            children.add(token);
            if (token.kind == open) depth++;
            else if (token.kind == close) depth--;
        }
        return new SyntaxNode(kind, children);
    }

    private SyntaxNode initializer() {
        var children = new ArrayList<SyntaxElement>();
        children.add(next());
        untilSemicolon(children);
        return new SyntaxNode(NodeKind.INITIALIZER, children);
    }

    /** Consume tokens up to, not including, a top-level semicolon or an unbalanced close brace */
    private void untilSemicolon(List<SyntaxElement> children) {
        var depth = 0;
        while (peek() != END_OF_FILE) {
            var kind = peek();
            if (depth == 0 && (kind == SEMICOLON || kind == CLOSE_BRACE)) return;
            children.add(next());
            if (kind == OPEN_PAREN || kind == OPEN_BRACKET || kind == OPEN_BRACE) depth++;
            else if ((kind == CLOSE_PAREN || kind == CLOSE_BRACKET || kind == CLOSE_BRACE) && depth > 0) depth--;
        }
    }

    private boolean atAny(TokenKind... kinds) {
        var kind = peek();
        for (var k : kinds) {
            if (k == kind) return true;
        }
        return false;
    }

    private static final Logger LOG = Logger.getLogger("main");
}
