package nl.bytesoflife.seed.lexer;

public enum TokenType {
    NONE,
    END_OF_INPUT,
    OPEN_PAREN,
    CLOSE_PAREN,
    STRING_LITERAL,
    IDENTIFIER
}
