package nl.bytesoflife.seed.lexer;

public record Token(TokenType type, SourceView view) {

    public boolean is(TokenType other) {
        return type == other;
    }

    public String text() {
        return view.text();
    }

    public int offset() {
        return view.offset();
    }

    @Override
    public String toString() {
        return type + "(" + view.text() + ")";
    }
}
