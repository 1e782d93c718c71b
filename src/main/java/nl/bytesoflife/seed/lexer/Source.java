package nl.bytesoflife.seed.lexer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The complete input of one run, held as a NUL-terminated byte buffer.
 * <p>
 * Offsets into a source stand in for pointers: tokens and AST leaves keep
 * {@link SourceView}s into the buffer instead of copies of their text.
 * A NUL byte anywhere in the input ends it.
 */
public final class Source {

    private final byte[] bytes;

    private Source(byte[] content) {
        this.bytes = Arrays.copyOf(content, content.length + 1);
    }

    public static Source of(byte[] content) {
        return new Source(content);
    }

    public static Source of(String content) {
        return new Source(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Number of input bytes, not counting the terminator.
     */
    public int length() {
        return bytes.length - 1;
    }

    /**
     * Byte at the offset, or {@code 0} at and beyond the end of the input.
     */
    public int byteAt(int offset) {
        if (offset < 0 || offset >= bytes.length) {
            return 0;
        }
        return bytes[offset] & 0xFF;
    }

    public String text(int offset, int length) {
        return new String(bytes, offset, length, StandardCharsets.UTF_8);
    }

    /**
     * Recomputes the line and column of an offset by scanning every byte before it.
     * Not cached: the cost grows with the offset, which is fine for error reporting.
     */
    public SourcePosition positionOf(int offset) {
        int end = Math.min(offset, length());
        int line = 1;
        int column = 1;
        for (int i = 0; i < end; i++) {
            if (bytes[i] == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return "Source{" + length() + " bytes}";
    }
}
