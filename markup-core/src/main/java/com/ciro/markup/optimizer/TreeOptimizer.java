package com.ciro.markup.optimizer;

import com.ciro.markup.MarkupValidationException;
import com.ciro.markup.ast.CommentNode;
import com.ciro.markup.ast.DocumentTree;
import com.ciro.markup.ast.ElementNode;
import com.ciro.markup.ast.MarkupNode;
import com.ciro.markup.ast.NodeCounts;
import com.ciro.markup.ast.NodeMetadata;
import com.ciro.markup.ast.NodeType;
import com.ciro.markup.ast.OptimizationMetrics;
import com.ciro.markup.ast.Ratio;
import com.ciro.markup.ast.StateClassStats;
import com.ciro.markup.ast.TextNode;
import com.ciro.markup.ast.TreeMetadata;
import com.ciro.markup.json.ObjectMapperFactory;
import com.ciro.markup.optimizer.OptimizationContext.Rewritten;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-proceso del árbol:
 * <ol>
 *   <li>agrupa nodos por firma estructural (clases de estado, solo para reportar);</li>
 *   <li>reescribe cada nodo: descarta atributos vacíos, descarta textos en blanco
 *       y fusiona textos consecutivos. Cada nodo de entrada se reescribe una sola vez
 *       y los subárboles idénticos de la salida comparten instancia;</li>
 *   <li>el resultado es inmutable por construcción;</li>
 *   <li>calcula métricas de nodos, memoria y clases.</li>
 * </ol>
 * No modifica el árbol de entrada.
 */
public class TreeOptimizer {

    private static final Logger log = LoggerFactory.getLogger(TreeOptimizer.class);

    private final NodeSignatures signatures;
    private final MemoryEstimator memory;

    public TreeOptimizer() {
        this(ObjectMapperFactory.create());
    }

    public TreeOptimizer(ObjectMapper mapper) {
        MarkupValidationException.requireNonNull(mapper, "mapper");
        this.signatures = new NodeSignatures(mapper);
        this.memory = new MemoryEstimator(mapper);
    }

    public OptimizedTree optimize(DocumentTree tree) {
        return optimize(tree, new OptimizationContext());
    }

    OptimizedTree optimize(DocumentTree tree, OptimizationContext ctx) {
        MarkupValidationException.requireNonNull(tree, "tree");

        // 1. Clases por firma
        List<StateClass> stateClasses = buildStateClasses(tree.root());

        // 2 + 3. Reescritura hacia nodos inmutables
        ElementNode optimizedRoot = (ElementNode) rewrite(tree.root(), ctx).node();

        // 4. Métricas
        MemoryEstimator.Totals before = memory.walk(tree.root());
        MemoryEstimator.Totals after = memory.walk(optimizedRoot);
        int members = stateClasses.stream().mapToInt(StateClass::size).sum();
        OptimizationMetrics metrics = new OptimizationMetrics(
                Ratio.of(before.nodes(), after.nodes()),
                Ratio.of(before.bytes(), after.bytes()),
                StateClassStats.of(stateClasses.size(), members));

        if (log.isDebugEnabled()) {
            log.debug("optimized tree: nodes {} -> {}, bytes {} -> {}, {} state classes, {} rewrites, {} shared",
                    before.nodes(), after.nodes(), before.bytes(), after.bytes(), stateClasses.size(),
                    ctx.rewrites(), ctx.hits());
        }

        TreeMetadata metadata = new TreeMetadata(NodeCounts.of(optimizedRoot),
                tree.metadata().minimizationMetrics(), metrics);
        return new OptimizedTree(new DocumentTree(optimizedRoot, metadata, tree.diagnostics()), stateClasses);
    }

    // ==============================================================
    // Fase 1: firmas
    // ==============================================================

    List<StateClass> buildStateClasses(ElementNode root) {
        Map<String, List<MarkupNode>> bySignature = new LinkedHashMap<>();
        collect(root, bySignature);

        List<StateClass> classes = new ArrayList<>();
        for (Map.Entry<String, List<MarkupNode>> e : bySignature.entrySet()) {
            if (e.getValue().size() > 1) {
                classes.add(new StateClass(classes.size(), e.getKey(), e.getValue()));
            }
        }
        return classes;
    }

    // Preorden con pila explícita: el orden de aparición fija los ids de clase
    private void collect(MarkupNode root, Map<String, List<MarkupNode>> bySignature) {
        Deque<MarkupNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            MarkupNode node = pending.pop();
            bySignature.computeIfAbsent(signatures.of(node), k -> new ArrayList<>()).add(node);
            List<MarkupNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    // ==============================================================
    // Fase 2: reescritura
    // ==============================================================

    /** Un nodo pendiente; {@code expanded} indica que sus hijos ya se apilaron. */
    private record Frame(MarkupNode node, boolean expanded) {}

    /**
     * Reescritura post-orden con pila explícita. Antes de descender se consulta la memo
     * por nodo de entrada, así cada nodo se optimiza una sola vez aunque aparezca
     * en varios lugares.
     */
    private Rewritten rewrite(MarkupNode root, OptimizationContext ctx) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            MarkupNode node = frame.node();

            if (frame.expanded()) {
                ctx.record(node, element(node, ctx));
                continue;
            }
            if (ctx.done(node) != null) continue;

            NodeMetadata md = node.metadata().asMinimized();
            switch (node.type()) {
                case TEXT -> ctx.record(node, text(node.value(), md, ctx));
                case COMMENT -> ctx.record(node, comment(node.value(), md, ctx));
                case ELEMENT -> {
                    stack.push(new Frame(node, true));
                    List<MarkupNode> children = node.children();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        MarkupNode child = children.get(i);
                        if (!isBlankText(child) && ctx.done(child) == null) {
                            stack.push(new Frame(child, false));
                        }
                    }
                }
            }
        }
        return ctx.done(root);
    }

    private Rewritten comment(String value, NodeMetadata md, OptimizationContext ctx) {
        NodeKey key = NodeKey.leaf(NodeType.COMMENT, value, md);
        return ctx.intern(key, () -> new CommentNode(value, md));
    }

    // Los hijos ya están reescritos
    private Rewritten element(MarkupNode node, OptimizationContext ctx) {
        NodeMetadata md = node.metadata().asMinimized();
        Map<String, String> attributes = new LinkedHashMap<>();
        node.attributes().forEach((k, v) -> {
            if (v != null && !v.isEmpty()) attributes.put(k, v);
        });

        List<Rewritten> rewritten = new ArrayList<>(node.children().size());
        for (MarkupNode child : node.children()) {
            // Texto vacío o en blanco se descarta antes de fusionar
            if (isBlankText(child)) continue;
            rewritten.add(ctx.done(child));
        }
        List<Rewritten> children = mergeText(rewritten, ctx);

        List<MarkupNode> childNodes = new ArrayList<>(children.size());
        List<NodeKey> childKeys = new ArrayList<>(children.size());
        for (Rewritten c : children) {
            childNodes.add(c.node());
            childKeys.add(c.key());
        }

        NodeKey key = NodeKey.element(node.name(), attributes, md, childKeys);
        return ctx.intern(key, () -> ElementNode.readOnly(node.name(), attributes, childNodes, md));
    }

    private static boolean isBlankText(MarkupNode node) {
        return node.type() == NodeType.TEXT && node.value().trim().isEmpty();
    }

    private List<Rewritten> mergeText(List<Rewritten> children, OptimizationContext ctx) {
        List<Rewritten> merged = new ArrayList<>(children.size());
        int i = 0;
        while (i < children.size()) {
            Rewritten c = children.get(i);
            if (c.node().type() != NodeType.TEXT) {
                merged.add(c);
                i++;
                continue;
            }
            int j = i + 1;
            while (j < children.size() && children.get(j).node().type() == NodeType.TEXT) j++;
            if (j == i + 1) {
                merged.add(c);
            } else {
                StringBuilder sb = new StringBuilder();
                for (int k = i; k < j; k++) sb.append(children.get(k).node().value());
                merged.add(text(sb.toString(), c.node().metadata(), ctx));
            }
            i = j;
        }
        return merged;
    }

    private Rewritten text(String value, NodeMetadata md, OptimizationContext ctx) {
        NodeKey key = NodeKey.leaf(NodeType.TEXT, value, md);
        return ctx.intern(key, () -> new TextNode(value, md));
    }
}
