package com.ciro.markup.optimizer;

import com.ciro.markup.ast.MarkupNode;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Estado de una sola optimización. Se crea por llamada a {@link TreeOptimizer#optimize} y no se comparte.
 * <ul>
 *   <li>{@code byInput}: nodo de entrada → resultado. Se consulta antes de descender,
 *       así un nodo alcanzable por varios caminos se reescribe una sola vez.</li>
 *   <li>{@code byContent}: clave de contenido → resultado. Internado de la salida:
 *       subárboles idénticos comparten la misma instancia y la misma clave.</li>
 * </ul>
 */
final class OptimizationContext {

    /** Nodo optimizado junto con su clave internada. */
    record Rewritten(MarkupNode node, NodeKey key) {}

    private final Map<MarkupNode, Rewritten> byInput = new IdentityHashMap<>();
    private final Map<NodeKey, Rewritten> byContent = new HashMap<>();
    private int rewrites;
    private int hits;

    Rewritten done(MarkupNode input) {
        return byInput.get(input);
    }

    void record(MarkupNode input, Rewritten result) {
        byInput.put(input, result);
        rewrites++;
    }

    Rewritten intern(NodeKey key, Supplier<MarkupNode> factory) {
        Rewritten cached = byContent.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        Rewritten created = new Rewritten(factory.get(), key);
        byContent.put(key, created);
        return created;
    }

    /** Nodos de entrada reescritos (cada uno una vez). */
    int rewrites() {
        return rewrites;
    }

    int hits() {
        return hits;
    }
}
