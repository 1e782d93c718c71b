package nl.bytesoflife.seed.ast;

import java.util.List;

/**
 * A parsed source: the arena holding every node and the handles of the
 * top-level forms in source order.
 */
public record Ast(AstArena arena, List<Integer> roots) {

    public Ast {
        roots = List.copyOf(roots);
    }

    public AstNode root(int index) {
        return arena.get(roots.get(index));
    }
}
