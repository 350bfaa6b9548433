package com.ciro.markup.parser;

import com.ciro.markup.MarkupValidationException;
import com.ciro.markup.ast.CommentNode;
import com.ciro.markup.ast.DocumentTree;
import com.ciro.markup.ast.ElementNode;
import com.ciro.markup.ast.NodeCounts;
import com.ciro.markup.ast.NodeMetadata;
import com.ciro.markup.ast.TextNode;
import com.ciro.markup.ast.TreeMetadata;
import com.ciro.markup.config.MarkupOptions;
import com.ciro.markup.fsm.AbstractState;
import com.ciro.markup.fsm.EquivalenceClasses;
import com.ciro.markup.token.CommentToken;
import com.ciro.markup.token.Diagnostic;
import com.ciro.markup.token.EndTagToken;
import com.ciro.markup.token.StartTagToken;
import com.ciro.markup.token.TextToken;
import com.ciro.markup.token.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Ensamblador O(N). Convierte los tokens en un árbol con una pila explícita
 * de elementos abiertos, sembrada con la raíz sintética.
 * <p>
 * Cada nodo creado lleva la clase de equivalencia del estado actual del modelo
 * abstracto. Ese estado no avanza con los tokens: es una etiqueta descriptiva.
 */
public class MarkupTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(MarkupTreeBuilder.class);

    private final EquivalenceClasses classes;
    private final AbstractState currentState;
    private final MarkupOptions options;

    public MarkupTreeBuilder(EquivalenceClasses classes, AbstractState currentState, MarkupOptions options) {
        this.classes = MarkupValidationException.requireNonNull(classes, "classes");
        this.currentState = MarkupValidationException.requireNonNull(currentState, "currentState");
        this.options = MarkupValidationException.requireNonNull(options, "options");
    }

    public DocumentTree build(List<Token> tokens) {
        MarkupValidationException.requireNonNull(tokens, "tokens");

        Build b = new Build();
        for (Token t : tokens) {
            try {
                if (!b.apply(t)) break;
            } catch (TreeBuildException e) {
                b.fail(e);
            }
        }

        NodeCounts counts = NodeCounts.of(b.root);
        if (log.isDebugEnabled()) {
            log.debug("built tree: {} nodes ({} elements, {} text, {} comments)",
                    counts.nodeCount(), counts.elementCount(), counts.textCount(), counts.commentCount());
        }
        return new DocumentTree(b.root, new TreeMetadata(counts, classes.metrics(), null), b.diagnostics);
    }

    /**
     * Estado de una sola construcción. La pila no es dueña de los nodos:
     * se descarta al terminar.
     */
    private final class Build {
        final ElementNode root = ElementNode.open(DocumentTree.ROOT_NAME, Map.of(), NodeMetadata.ROOT);
        final Deque<ElementNode> stack = new ArrayDeque<>();
        final List<Diagnostic> diagnostics = new ArrayList<>();
        final NodeMetadata stamp = NodeMetadata.tagged(classes.classOf(currentState));

        Build() {
            stack.push(root);
        }

        /** @return false cuando se alcanza EOF */
        boolean apply(Token token) {
            switch (token.type()) {
                case START_TAG -> startTag((StartTagToken) token);
                case END_TAG -> endTag((EndTagToken) token);
                case TEXT -> {
                    TextToken text = (TextToken) token;
                    if (text.significant()) {
                        current(token).appendChild(new TextNode(text.content(), stamp));
                    }
                }
                case COMMENT -> current(token).appendChild(new CommentNode(((CommentToken) token).content(), stamp));
                case DOCTYPE, CDATA -> {
                    // Sin efecto en el árbol
                }
                case EOF -> {
                    closeAtEof(token);
                    return false;
                }
            }
            return true;
        }

        private void startTag(StartTagToken t) {
            ElementNode el = ElementNode.open(t.name(), t.attributes(), stamp);
            current(t).appendChild(el);
            // Si NO es de auto-cierre, pasa a ser el punto de inserción
            if (!t.selfClosing()) {
                stack.push(el);
            }
        }

        private void endTag(EndTagToken t) {
            // Buscar desde la cima hacia la raíz (sin incluirla)
            int depth = 0;
            boolean found = false;
            Iterator<ElementNode> it = stack.iterator();
            while (it.hasNext()) {
                ElementNode open = it.next();
                if (open == root) break;
                if (open.name().equals(t.name())) {
                    found = true;
                    break;
                }
                depth++;
            }

            if (!found) {
                diagnostics.add(Diagnostic.warning("Ignoring unmatched end tag </" + t.name() + ">", t.span()));
                return;
            }
            // Cierra también todo lo que quedó abierto por encima (HTML mal formado)
            for (int i = 0; i <= depth; i++) {
                stack.pop();
            }
        }

        private void closeAtEof(Token eof) {
            if (options.isAllowUnclosedTags()) return;
            for (ElementNode open : stack) {
                if (open != root) {
                    fail(new TreeBuildException("Unclosed element <" + open.name() + ">", eof));
                }
            }
        }

        private ElementNode current(Token token) {
            ElementNode top = stack.peek();
            if (top == null) {
                throw new TreeBuildException("Open-element stack is empty", token);
            }
            if (top.isReadOnly()) {
                throw new TreeBuildException("Element <" + top.name() + "> is read-only", token);
            }
            return top;
        }

        void fail(TreeBuildException e) {
            Token t = e.getToken();
            log.warn("Recoverable parser error at {}:{}: {}", t.span().line(), t.span().column(), e.getMessage());
            diagnostics.add(Diagnostic.error(e.getMessage(), t.span()));
        }
    }
}
