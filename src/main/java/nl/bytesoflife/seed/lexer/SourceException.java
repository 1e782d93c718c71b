package nl.bytesoflife.seed.lexer;

/**
 * A failure tied to a location in the source. There is no recovery: the first
 * one thrown ends the run.
 */
public class SourceException extends RuntimeException {

    private final SourcePosition position;

    public SourceException(String message, SourcePosition position) {
        super(message);
        this.position = position;
    }

    public SourcePosition getPosition() {
        return position;
    }

    /**
     * The message prefixed with its position, e.g. {@code 3:7: expected `)`}.
     */
    public String getDiagnostic() {
        return position + ": " + getMessage();
    }
}
