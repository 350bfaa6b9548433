package com.ciro.markup.optimizer;

import com.ciro.markup.ast.DocumentTree;
import com.ciro.markup.ast.ElementNode;
import com.ciro.markup.ast.OptimizationMetrics;

import java.util.List;

/**
 * Salida del optimizador: el árbol inmutable (con {@code optimizationMetrics}
 * en sus metadatos) y las clases de firma encontradas en la entrada.
 */
public record OptimizedTree(DocumentTree document, List<StateClass> stateClasses) {

    public OptimizedTree {
        stateClasses = List.copyOf(stateClasses);
    }

    public ElementNode root() {
        return document.root();
    }

    public OptimizationMetrics metrics() {
        return document.metadata().optimizationMetrics();
    }
}
