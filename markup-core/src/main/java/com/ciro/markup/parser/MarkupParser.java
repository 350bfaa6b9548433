package com.ciro.markup.parser;

import com.ciro.markup.MarkupValidationException;
import com.ciro.markup.ast.DocumentTree;
import com.ciro.markup.config.MarkupOptions;
import com.ciro.markup.fsm.EquivalenceClasses;
import com.ciro.markup.fsm.PartitionMinimizer;
import com.ciro.markup.fsm.StateModel;
import com.ciro.markup.token.Diagnostic;
import com.ciro.markup.token.MarkupTokenizer;
import com.ciro.markup.token.TokenizeResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Punto de entrada: tokeniza, minimiza el modelo de estados y construye el árbol.
 * Cada llamada usa su propio modelo y su propia pila; la instancia solo guarda opciones.
 */
public class MarkupParser {

    private final MarkupOptions options;

    public MarkupParser() {
        this(MarkupOptions.defaults());
    }

    public MarkupParser(MarkupOptions options) {
        this.options = MarkupValidationException.requireNonNull(options, "options").copy();
    }

    public TokenizeResult tokenize(String input) {
        return MarkupTokenizer.tokenize(input, options);
    }

    public DocumentTree parse(String input) {
        TokenizeResult lexed = tokenize(input);

        StateModel model = StateModel.create();
        EquivalenceClasses classes = PartitionMinimizer.minimize(model.states());

        DocumentTree built = new MarkupTreeBuilder(classes, model.current(), options).build(lexed.tokens());

        List<Diagnostic> diagnostics = new ArrayList<>(lexed.diagnostics());
        diagnostics.addAll(built.diagnostics());
        return new DocumentTree(built.root(), built.metadata(), diagnostics);
    }
}
