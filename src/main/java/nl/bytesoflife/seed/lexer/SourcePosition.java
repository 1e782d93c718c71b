package nl.bytesoflife.seed.lexer;

/**
 * A 1-based line and column in a {@link Source}.
 */
public record SourcePosition(int line, int column) {

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
