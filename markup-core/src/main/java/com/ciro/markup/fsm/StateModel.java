package com.ciro.markup.fsm;

import java.util.List;

/**
 * Autómata fijo de seis estados que describe las fases de parseo de markup.
 * <p>
 * No avanza con los tokens: su estado actual es siempre {@code Initial}.
 * Solo existe para minimizarse y estampar la clase de equivalencia resultante
 * como metadato descriptivo en los nodos del árbol.
 */
public final class StateModel {

    public static final String INITIAL = "Initial";
    public static final String IN_TAG = "InTag";
    public static final String IN_CONTENT = "InContent";
    public static final String IN_COMMENT = "InComment";
    public static final String IN_DOCTYPE = "InDoctype";
    public static final String FINAL = "Final";

    private final List<AbstractState> states;
    private final AbstractState current;

    private StateModel(List<AbstractState> states, AbstractState current) {
        this.states = states;
        this.current = current;
    }

    /**
     * Crea una instancia nueva; cada parse usa la suya.
     */
    public static StateModel create() {
        AbstractState initial = new AbstractState(INITIAL, false);
        AbstractState inTag = new AbstractState(IN_TAG, false);
        AbstractState inContent = new AbstractState(IN_CONTENT, true);
        AbstractState inComment = new AbstractState(IN_COMMENT, false);
        AbstractState inDoctype = new AbstractState(IN_DOCTYPE, false);
        AbstractState fin = new AbstractState(FINAL, true);

        initial.on("<", inTag).on("text", inContent);
        inTag.on(">", inContent).on("!", inDoctype).on("<!--", inComment);
        inContent.on("<", inTag).on("EOF", fin);
        inComment.on("-->", inContent);
        inDoctype.on(">", inContent);

        return new StateModel(List.of(initial, inTag, inContent, inComment, inDoctype, fin), initial);
    }

    public List<AbstractState> states() {
        return states;
    }

    public AbstractState current() {
        return current;
    }

    public AbstractState state(String label) {
        return states.stream()
                .filter(s -> s.label().equals(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown state: " + label));
    }
}
