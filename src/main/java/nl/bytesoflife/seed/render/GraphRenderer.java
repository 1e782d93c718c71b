package nl.bytesoflife.seed.render;

import nl.bytesoflife.seed.ast.Ast;
import nl.bytesoflife.seed.ast.AstArena;
import nl.bytesoflife.seed.ast.AstNode;

import java.util.List;

/**
 * Renders an AST as a Graphviz digraph, one cluster per top-level form.
 * <p>
 * Node ids come from one counter shared by the whole graph, so they are unique
 * across clusters. Nodes are emitted in pre-order with children in source order,
 * which makes the output a deterministic function of the AST.
 */
public class GraphRenderer {

    private String graphKeyword = "digraph";
    private String clusterPrefix = "subgraph cluster";
    private String indent = "\t";

    public GraphRenderer withGraphKeyword(String graphKeyword) {
        this.graphKeyword = graphKeyword;
        return this;
    }

    public GraphRenderer withClusterPrefix(String clusterPrefix) {
        this.clusterPrefix = clusterPrefix;
        return this;
    }

    public GraphRenderer withIndent(String indent) {
        this.indent = indent;
        return this;
    }

    public String render(Ast ast) {
        return render(ast.roots(), ast.arena());
    }

    public String render(List<Integer> roots, AstArena arena) {
        RenderState state = new RenderState(arena);

        state.out.append(graphKeyword).append(" {\n");
        for (int i = 0; i < roots.size(); i++) {
            renderCluster(state, roots.get(i), clusterPrefix + i);
        }
        state.out.append("}\n");

        return state.out.toString();
    }

    private void renderCluster(RenderState state, int root, String title) {
        state.out.append(indent).append(title).append(" {\n");
        // The root's parent id equals its own id, which suppresses its incoming edge.
        renderNode(state, root, state.nextId, 2);
        state.nextId++;
        state.out.append(indent).append("}\n");
    }

    private void renderNode(RenderState state, int handle, int parentId, int depth) {
        AstNode node = state.arena.get(handle);

        if (node instanceof AstNode.SList list) {
            int id = declare(state, list.operator().text(), parentId, depth);
            for (int child : list.children()) {
                renderNode(state, child, id, depth);
                state.nextId++;
            }
        } else if (node instanceof AstNode.SIdentifier identifier) {
            declare(state, identifier.token().text(), parentId, depth);
        } else if (node instanceof AstNode.SString string) {
            declare(state, string.token().text(), parentId, depth);
        } else if (node instanceof AstNode.SEmpty) {
            // no graph node for ()
        }
    }

    private int declare(RenderState state, String label, int parentId, int depth) {
        int id = state.nextId++;
        String prefix = indent.repeat(depth);

        state.out.append(prefix).append('n').append(id)
                .append(" [label=\"").append(escapeLabel(label)).append("\"];\n");
        if (id != parentId) {
            state.out.append(prefix).append('n').append(parentId)
                    .append(" -> n").append(id).append(";\n");
        }
        return id;
    }

    static String escapeLabel(String label) {
        if (label.indexOf('"') < 0 && label.indexOf('\\') < 0) {
            return label;
        }
        StringBuilder sb = new StringBuilder(label.length() + 8);
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static class RenderState {
        private final AstArena arena;
        private final StringBuilder out = new StringBuilder();
        private int nextId;

        RenderState(AstArena arena) {
            this.arena = arena;
        }
    }
}
