package com.ciro.markup.fsm;

import com.ciro.markup.MarkupValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estado del autómata abstracto de fases de parseo.
 * La identidad es por instancia: dos estados con la misma etiqueta siguen siendo distintos.
 */
public final class AbstractState {

    private final String label;
    private final boolean accepting;
    private final Map<String, AbstractState> transitions = new LinkedHashMap<>();

    public AbstractState(String label, boolean accepting) {
        this.label = MarkupValidationException.requireNonNull(label, "label");
        this.accepting = accepting;
    }

    public String label() {
        return label;
    }

    public boolean isAccepting() {
        return accepting;
    }

    public Map<String, AbstractState> transitions() {
        return Collections.unmodifiableMap(transitions);
    }

    AbstractState on(String symbol, AbstractState target) {
        MarkupValidationException.requireNonNull(symbol, "symbol");
        transitions.put(symbol, MarkupValidationException.requireNonNull(target, "target"));
        return this;
    }

    @Override
    public String toString() {
        return label + (accepting ? "(accepting)" : "");
    }
}
