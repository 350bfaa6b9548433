package com.ciro.markup.fsm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Minimización por refinamiento de particiones (algoritmo de Moore).
 * <p>
 * Partición inicial: {aceptación}, {no aceptación}. En cada pasada cada bloque
 * se divide según la firma de sus estados (pares {@code simbolo:bloqueDestino}
 * ordenados, calculados sobre la partición actual) hasta que el número de
 * bloques deja de crecer.
 */
public final class PartitionMinimizer {

    private static final Logger log = LoggerFactory.getLogger(PartitionMinimizer.class);

    private PartitionMinimizer() {}

    public static EquivalenceClasses minimize(Collection<AbstractState> states) {
        Set<AbstractState> all = new LinkedHashSet<>(states);

        List<Set<AbstractState>> partition = new ArrayList<>();
        Set<AbstractState> accepting = all.stream()
                .filter(AbstractState::isAccepting)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<AbstractState> rejecting = all.stream()
                .filter(s -> !s.isAccepting())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!accepting.isEmpty()) partition.add(accepting);
        if (!rejecting.isEmpty()) partition.add(rejecting);

        int passes = 0;
        while (true) {
            passes++;
            Map<AbstractState, Integer> blockOf = indexBlocks(partition);
            List<Set<AbstractState>> refined = new ArrayList<>();
            for (Set<AbstractState> block : partition) {
                refined.addAll(split(block, blockOf));
            }
            // Solo se divide, nunca se une: si el tamaño no cambia, es punto fijo
            if (refined.size() == partition.size()) break;
            partition = refined;
        }

        Map<Integer, Set<AbstractState>> classes = new LinkedHashMap<>();
        for (int i = 0; i < partition.size(); i++) {
            classes.put(i, partition.get(i));
        }
        log.debug("minimized {} states into {} classes in {} passes", all.size(), classes.size(), passes);
        return new EquivalenceClasses(classes, all.size());
    }

    private static List<Set<AbstractState>> split(Set<AbstractState> block, Map<AbstractState, Integer> blockOf) {
        if (block.size() <= 1) return List.of(block);

        Map<String, Set<AbstractState>> bySignature = new LinkedHashMap<>();
        for (AbstractState state : block) {
            bySignature.computeIfAbsent(signature(state, blockOf), k -> new LinkedHashSet<>()).add(state);
        }
        return new ArrayList<>(bySignature.values());
    }

    static String signature(AbstractState state, Map<AbstractState, Integer> blockOf) {
        return state.transitions().entrySet().stream()
                .map(e -> e.getKey() + ":" + blockOf.getOrDefault(e.getValue(), -1))
                .sorted()
                .collect(Collectors.joining("|"));
    }

    private static Map<AbstractState, Integer> indexBlocks(List<Set<AbstractState>> partition) {
        Map<AbstractState, Integer> index = new IdentityHashMap<>();
        for (int i = 0; i < partition.size(); i++) {
            for (AbstractState s : partition.get(i)) {
                index.put(s, i);
            }
        }
        return index;
    }
}
