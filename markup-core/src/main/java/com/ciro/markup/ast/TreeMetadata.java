package com.ciro.markup.ast;

import com.ciro.markup.MarkupValidationException;
import com.ciro.markup.fsm.MinimizationMetrics;

import java.util.Optional;

/**
 * Metadatos agregados del árbol. {@code optimizationMetrics} es null hasta que
 * el árbol pasa por el optimizador.
 */
public record TreeMetadata(NodeCounts counts, MinimizationMetrics minimizationMetrics,
                           OptimizationMetrics optimizationMetrics) {

    public TreeMetadata {
        MarkupValidationException.requireNonNull(counts, "counts");
        MarkupValidationException.requireNonNull(minimizationMetrics, "minimizationMetrics");
    }

    public int nodeCount() { return counts.nodeCount(); }
    public int elementCount() { return counts.elementCount(); }
    public int textCount() { return counts.textCount(); }
    public int commentCount() { return counts.commentCount(); }

    public Optional<OptimizationMetrics> optimization() {
        return Optional.ofNullable(optimizationMetrics);
    }

    public TreeMetadata withOptimization(OptimizationMetrics metrics) {
        return new TreeMetadata(counts, minimizationMetrics, metrics);
    }
}
