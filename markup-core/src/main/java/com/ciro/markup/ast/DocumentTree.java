package com.ciro.markup.ast;

import com.ciro.markup.MarkupValidationException;
import com.ciro.markup.token.Diagnostic;

import java.util.List;

/**
 * Árbol completo: raíz sintética {@code root}, metadatos y los diagnósticos
 * acumulados (tokenizador + constructor) en orden de aparición.
 */
public record DocumentTree(ElementNode root, TreeMetadata metadata, List<Diagnostic> diagnostics) {

    public static final String ROOT_NAME = "root";

    public DocumentTree {
        MarkupValidationException.requireNonNull(root, "root");
        MarkupValidationException.requireNonNull(metadata, "metadata");
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }
}
