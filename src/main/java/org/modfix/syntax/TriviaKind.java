package org.modfix.syntax;

public enum TriviaKind {
    WHITESPACE,
    END_OF_LINE,
    COMMENT,
    /** A directive line such as {@code #region} */
    OTHER,
}
