package org.pragmatica.rewrite.tree;

/**
 * Lexical category of a token.
 */
public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    INTEGER_LITERAL,
    PUNCTUATION,
    END_OF_FILE
}
