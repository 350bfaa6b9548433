package com.ciro.markup.fsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resultado de la minimización: id de clase -> estados indistinguibles.
 * Las clases son disjuntas y su unión es el conjunto completo de estados.
 */
public final class EquivalenceClasses {

    /** Id reportado para un estado que no pertenece a ninguna clase */
    public static final int UNKNOWN_CLASS = -1;

    private final Map<Integer, Set<AbstractState>> classes;
    private final int originalStateCount;

    EquivalenceClasses(Map<Integer, Set<AbstractState>> classes, int originalStateCount) {
        Map<Integer, Set<AbstractState>> copy = new LinkedHashMap<>();
        classes.forEach((id, members) -> copy.put(id, Collections.unmodifiableSet(members)));
        this.classes = Collections.unmodifiableMap(copy);
        this.originalStateCount = originalStateCount;
    }

    public Map<Integer, Set<AbstractState>> asMap() {
        return classes;
    }

    public int size() {
        return classes.size();
    }

    public int classOf(AbstractState state) {
        for (Map.Entry<Integer, Set<AbstractState>> e : classes.entrySet()) {
            if (e.getValue().contains(state)) return e.getKey();
        }
        return UNKNOWN_CLASS;
    }

    public MinimizationMetrics metrics() {
        return MinimizationMetrics.of(originalStateCount, classes.size());
    }
}
