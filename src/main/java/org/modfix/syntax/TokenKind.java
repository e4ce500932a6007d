package org.modfix.syntax;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHARACTER,

    // Member modifiers
    PUBLIC("public", true),
    PROTECTED("protected", true),
    PRIVATE("private", true),
    INTERNAL("internal", true),
    STATIC("static", true),
    NEW("new", true),
    ABSTRACT("abstract", true),
    VIRTUAL("virtual", true),
    OVERRIDE("override", true),
    SEALED("sealed", true),
    READONLY("readonly", true),
    EXTERN("extern", true),
    VOLATILE("volatile", true),
    UNSAFE("unsafe", true),
    PARTIAL("partial", true),

    // Type declaration keywords
    CLASS("class"),
    INTERFACE("interface"),
    STRUCT("struct"),
    ENUM("enum"),
    NAMESPACE("namespace"),

    OPEN_BRACE("{"),
    CLOSE_BRACE("}"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    OPEN_BRACKET("["),
    CLOSE_BRACKET("]"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    SEMICOLON(";"),
    COMMA(","),
    DOT("."),
    EQUALS("="),
    /** Any other operator character */
    OPERATOR,
    /** A character the lexer does not understand */
    BAD,
    END_OF_FILE;

    /** Fixed text of keywords and punctuation, null for tokens whose text varies */
    public final String text;

    public final boolean isModifier;

    TokenKind() {
        this(null, false);
    }

    TokenKind(String text) {
        this(text, false);
    }

    TokenKind(String text, boolean isModifier) {
        this.text = text;
        this.isModifier = isModifier;
    }

    private boolean isKeyword() {
        return text != null && Character.isLetter(text.charAt(0));
    }

    public boolean isTypeDeclarationKeyword() {
        return this == CLASS || this == INTERFACE || this == STRUCT || this == ENUM;
    }

    private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();
    private static final Map<Character, TokenKind> PUNCTUATION = new HashMap<>();

    static {
        for (var kind : values()) {
            if (kind.text == null) continue;
            if (kind.isKeyword()) KEYWORDS.put(kind.text, kind);
            else PUNCTUATION.put(kind.text.charAt(0), kind);
        }
    }

    public static Optional<TokenKind> keyword(String word) {
        return Optional.ofNullable(KEYWORDS.get(word));
    }

    static Optional<TokenKind> punctuation(char c) {
        return Optional.ofNullable(PUNCTUATION.get(c));
    }
}
