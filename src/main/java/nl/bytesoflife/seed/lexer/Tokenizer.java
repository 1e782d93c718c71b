package nl.bytesoflife.seed.lexer;

/**
 * Splits a {@link Source} into tokens, one call at a time.
 * <p>
 * {@link #next(Source, int)} is a pure function of the cursor: it classifies the bytes
 * at the cursor and returns the token together with the cursor just past it.
 * Classification, in order:
 * <ol>
 *   <li>the terminator yields {@link TokenType#END_OF_INPUT} and leaves the cursor in place;</li>
 *   <li>{@code (} and {@code )} yield single-byte paren tokens;</li>
 *   <li>{@code "} or {@code '} not directly after a backslash opens a string literal that runs to
 *       the next identical quote, with no escapes; the token text excludes both quotes;</li>
 *   <li>any other non-whitespace byte starts an identifier, running up to whitespace, a paren
 *       or the end. A leading backslash is consumed but left out of the identifier text;</li>
 *   <li>whitespace (space, {@code \n}, {@code \t}, {@code \v}, {@code \f}) is skipped and
 *       classification starts over.</li>
 * </ol>
 * Every byte falls under one of these, so the only lexical error is a string literal that
 * reaches the end of the input.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public record Scan(Token token, int cursor) {
    }

    public static Scan next(Source source, int cursor) {
        int pos = cursor;
        while (isWhitespace(source.byteAt(pos))) {
            pos++;
        }

        int c = source.byteAt(pos);

        if (c == 0) {
            return new Scan(new Token(TokenType.END_OF_INPUT, new SourceView(source, pos, 0)), pos);
        }
        if (c == '(') {
            return new Scan(new Token(TokenType.OPEN_PAREN, new SourceView(source, pos, 1)), pos + 1);
        }
        if (c == ')') {
            return new Scan(new Token(TokenType.CLOSE_PAREN, new SourceView(source, pos, 1)), pos + 1);
        }
        if (isQuote(c) && source.byteAt(pos - 1) != '\\') {
            return scanString(source, pos, c);
        }
        return scanIdentifier(source, pos);
    }

    private static Scan scanString(Source source, int open, int quote) {
        int end = open + 1;
        while (source.byteAt(end) != quote) {
            if (source.byteAt(end) == 0) {
                throw new UnexpectedCharacterException(
                        "unterminated string literal", quote, source.positionOf(open));
            }
            end++;
        }
        SourceView view = new SourceView(source, open + 1, end - open - 1);
        return new Scan(new Token(TokenType.STRING_LITERAL, view), end + 1);
    }

    private static Scan scanIdentifier(Source source, int start) {
        int textStart = source.byteAt(start) == '\\' ? start + 1 : start;
        int end = start + 1;
        while (!endsIdentifier(source.byteAt(end))) {
            end++;
        }
        SourceView view = new SourceView(source, textStart, end - textStart);
        return new Scan(new Token(TokenType.IDENTIFIER, view), end);
    }

    static boolean isWhitespace(int c) {
        return c == ' ' || c == '\n' || c == '\t' || c == 0x0B || c == '\f';
    }

    private static boolean isQuote(int c) {
        return c == '"' || c == '\'';
    }

    private static boolean endsIdentifier(int c) {
        return c == 0 || c == '(' || c == ')' || isWhitespace(c);
    }

    /**
     * Input that ends where a token still needs a byte, such as a closing quote.
     */
    public static class UnexpectedCharacterException extends SourceException {
        private final int character;

        public UnexpectedCharacterException(String message, int character, SourcePosition position) {
            super(message, position);
            this.character = character;
        }

        public int getCharacter() {
            return character;
        }
    }
}
