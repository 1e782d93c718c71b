package nl.bytesoflife.seed.lexer;

/**
 * Token stream over a {@link Source} with one token of lookahead.
 * The first token is scanned when the lexer is created.
 */
public class Lexer {

    private final Source source;
    private int cursor;
    private Token lookahead;

    public Lexer(Source source) {
        this.source = source;
        this.cursor = 0;
        advance();
    }

    public Token peek() {
        return lookahead;
    }

    /**
     * Returns the lookahead and scans the token after it.
     */
    public Token advance() {
        Token current = lookahead;
        Tokenizer.Scan scan = Tokenizer.next(source, cursor);
        lookahead = scan.token();
        cursor = scan.cursor();
        return current;
    }

    /**
     * Line and column of the scan cursor, which sits just past the lookahead.
     * Once the input is exhausted this is the end of the input.
     */
    public SourcePosition position() {
        return source.positionOf(cursor);
    }

    public SourcePosition positionOf(Token token) {
        return source.positionOf(token.offset());
    }
}
