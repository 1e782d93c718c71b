package nl.bytesoflife.seed.lexer;

/**
 * A run of bytes inside a {@link Source}. The bytes are not copied.
 */
public record SourceView(Source source, int offset, int length) {

    public SourceView {
        if (offset < 0 || length < 0 || offset + length > source.length()) {
            throw new IndexOutOfBoundsException(
                    "View [" + offset + ", " + (offset + length) + ") outside source of " + source.length() + " bytes");
        }
    }

    public String text() {
        return source.text(offset, length);
    }

    @Override
    public String toString() {
        return text();
    }
}
