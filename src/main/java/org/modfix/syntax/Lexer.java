package org.modfix.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into tokens that own all the trivia around them. A token's trailing trivia runs up to and
 * including the first line break after it; everything after that belongs to the next token's leading trivia. The
 * last token is always END_OF_FILE, which carries whatever trivia ends the file.
 */
class Lexer {
    private final String text;
    private int pos = 0;

    Lexer(String text) {
        this.text = text;
    }

    static List<SyntaxToken> tokenize(String text) {
        return new Lexer(text).tokenize();
    }

    List<SyntaxToken> tokenize() {
        var tokens = new ArrayList<SyntaxToken>();
        while (true) {
            var leading = scanTrivia(false);
            if (pos >= text.length()) {
                tokens.add(new SyntaxToken(TokenKind.END_OF_FILE, "", leading, List.of()));
                return tokens;
            }
            var start = pos;
            var kind = scanToken();
            var tokenText = text.substring(start, pos);
            var trailing = scanTrivia(true);
            tokens.add(new SyntaxToken(kind, tokenText, leading, trailing));
        }
    }

    private List<Trivia> scanTrivia(boolean trailing) {
        var trivia = new ArrayList<Trivia>();
        while (pos < text.length()) {
            var c = text.charAt(pos);
            var start = pos;
            if (SourceText.isHorizontalWhitespace(c)) {
                while (pos < text.length() && SourceText.isHorizontalWhitespace(text.charAt(pos))) pos++;
                trivia.add(Trivia.whitespace(text.substring(start, pos)));
            } else if (SourceText.isLineBreak(c)) {
                pos++;
                if (c == '\r' && pos < text.length() && text.charAt(pos) == '\n') pos++;
                trivia.add(Trivia.endOfLine(text.substring(start, pos)));
                if (trailing) break;
            } else if (text.startsWith("//", pos)) {
                skipToLineBreak();
                trivia.add(Trivia.comment(text.substring(start, pos)));
            } else if (text.startsWith("/*", pos)) {
                var close = text.indexOf("*/", pos + 2);
                pos = close == -1 ? text.length() : close + 2;
                trivia.add(Trivia.comment(text.substring(start, pos)));
            } else if (c == '#' && !trailing && atLineStart(pos)) {
                skipToLineBreak();
                trivia.add(Trivia.of(TriviaKind.OTHER, text.substring(start, pos)));
            } else {
                break;
            }
        }
        return trivia;
    }

    private void skipToLineBreak() {
        while (pos < text.length() && !SourceText.isLineBreak(text.charAt(pos))) pos++;
    }

    private boolean atLineStart(int offset) {
        for (var i = offset - 1; i >= 0; i--) {
            var c = text.charAt(i);
            if (SourceText.isLineBreak(c)) return true;
            if (!SourceText.isHorizontalWhitespace(c)) return false;
        }
        return true;
    }

    private TokenKind scanToken() {
        var c = text.charAt(pos);
        if (isIdentifierStart(c)) {
            var start = pos;
            pos++;
            while (pos < text.length() && isIdentifierPart(text.charAt(pos))) pos++;
            var word = text.substring(start, pos);
            return TokenKind.keyword(word).orElse(TokenKind.IDENTIFIER);
        }
        if (Character.isDigit(c)) {
            pos++;
            while (pos < text.length() && (isIdentifierPart(text.charAt(pos)) || text.charAt(pos) == '.')) pos++;
            return TokenKind.NUMBER;
        }
        if (c == '"') {
            scanQuoted('"');
            return TokenKind.STRING;
        }
        if (c == '\'') {
            scanQuoted('\'');
            return TokenKind.CHARACTER;
        }
        pos++;
        var punctuation = TokenKind.punctuation(c);
        if (punctuation.isPresent()) return punctuation.get();
        if ("+-*/%&|^!~?:@".indexOf(c) != -1) return TokenKind.OPERATOR;
        return TokenKind.BAD;
    }

    /** Quoted literals stop at the closing quote or, if unterminated, at the end of the line. */
    private void scanQuoted(char quote) {
        pos++;
        while (pos < text.length()) {
            var c = text.charAt(pos);
            if (SourceText.isLineBreak(c)) return;
            pos++;
            if (c == '\\' && pos < text.length() && !SourceText.isLineBreak(text.charAt(pos))) pos++;
            else if (c == quote) return;
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
