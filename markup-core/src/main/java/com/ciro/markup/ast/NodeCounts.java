package com.ciro.markup.ast;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Conteo de nodos del árbol. La raíz sintética NO se cuenta.
 * El recorrido usa una pila explícita: la profundidad del árbol solo está acotada por la entrada.
 */
public record NodeCounts(int nodeCount, int elementCount, int textCount, int commentCount) {

    public static NodeCounts of(ElementNode root) {
        int nodes = 0, elements = 0, texts = 0, comments = 0;

        Deque<MarkupNode> pending = new ArrayDeque<>(root.children());
        while (!pending.isEmpty()) {
            MarkupNode node = pending.pop();
            nodes++;
            switch (node.type()) {
                case ELEMENT -> elements++;
                case TEXT -> texts++;
                case COMMENT -> comments++;
            }
            for (MarkupNode child : node.children()) {
                pending.push(child);
            }
        }
        return new NodeCounts(nodes, elements, texts, comments);
    }
}
