package nl.bytesoflife.seed.ast;

import nl.bytesoflife.seed.lexer.Token;

import java.util.List;

/**
 * A node stored by value in an {@link AstArena}. Nodes refer to their children by
 * arena handle, never by reference, and carry no behaviour of their own.
 */
public sealed interface AstNode permits AstNode.SList, AstNode.SIdentifier, AstNode.SString, AstNode.SEmpty {

    /**
     * A parenthesized form: its first element is the operator, the rest are children.
     */
    record SList(Token operator, List<Integer> children) implements AstNode {
        public SList {
            children = List.copyOf(children);
        }
    }

    record SIdentifier(Token token) implements AstNode {
    }

    /**
     * A quoted string. The token's view already excludes the quotes.
     */
    record SString(Token token) implements AstNode {
    }

    /**
     * The result of parsing {@code ()}.
     */
    record SEmpty() implements AstNode {
    }
}
