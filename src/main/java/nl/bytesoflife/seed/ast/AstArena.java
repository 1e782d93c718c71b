package nl.bytesoflife.seed.ast;

import nl.bytesoflife.seed.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only store for AST nodes. {@link #add(AstNode)} hands out handles
 * 0, 1, 2, ... in insertion order; a handle stays valid for the arena's lifetime.
 */
public class AstArena {

    private final List<AstNode> nodes = new ArrayList<>();

    /**
     * Appends a node and returns its handle. A list may only refer to nodes that are
     * already in the arena, which keeps the arena a forest.
     */
    public int add(AstNode node) {
        if (node instanceof AstNode.SList list) {
            for (int child : list.children()) {
                if (child < 0 || child >= nodes.size()) {
                    throw new IllegalArgumentException(
                            "Child handle " + child + " does not refer to an existing node (size " + nodes.size() + ")");
                }
            }
        }
        nodes.add(node);
        return nodes.size() - 1;
    }

    public AstNode get(int handle) {
        if (handle < 0 || handle >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node with handle " + handle + " (size " + nodes.size() + ")");
        }
        return nodes.get(handle);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Writes the subtree under a handle back out as an S-expression with single spaces,
     * strings in double quotes.
     */
    public String format(int handle) {
        StringBuilder sb = new StringBuilder();
        format(handle, sb);
        return sb.toString();
    }

    private void format(int handle, StringBuilder sb) {
        AstNode node = get(handle);
        if (node instanceof AstNode.SList list) {
            sb.append('(');
            if (list.operator().is(TokenType.STRING_LITERAL)) {
                sb.append('"').append(list.operator().text()).append('"');
            } else {
                sb.append(list.operator().text());
            }
            for (int child : list.children()) {
                sb.append(' ');
                format(child, sb);
            }
            sb.append(')');
        } else if (node instanceof AstNode.SIdentifier identifier) {
            sb.append(identifier.token().text());
        } else if (node instanceof AstNode.SString string) {
            sb.append('"').append(string.token().text()).append('"');
        } else if (node instanceof AstNode.SEmpty) {
            sb.append("()");
        }
    }

    @Override
    public String toString() {
        return "AstArena{nodes=" + nodes.size() + "}";
    }
}
