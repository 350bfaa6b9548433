package com.ciro.markup.optimizer;

import com.ciro.markup.ast.MarkupNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Firma estructural de un nodo:
 * {@code tipo | nombre | [[attr,valor],...] | tipoHijo1,tipoHijo2,...}.
 * Los segmentos vacíos (sin nombre, sin atributos, sin hijos) se omiten.
 */
final class NodeSignatures {

    private final ObjectMapper mapper;

    NodeSignatures(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String of(MarkupNode node) {
        List<String> parts = new ArrayList<>();
        parts.add(node.type().label());

        if (node.name() != null && !node.name().isEmpty()) {
            parts.add(node.name());
        }

        Map<String, String> attrs = node.attributes();
        if (!attrs.isEmpty()) {
            List<List<String>> sorted = attrs.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .map(e -> Arrays.asList(e.getKey(), e.getValue()))
                    .collect(Collectors.toList());
            parts.add(json(sorted));
        }

        if (!node.children().isEmpty()) {
            parts.add(node.children().stream()
                    .map(c -> c.type().label())
                    .collect(Collectors.joining(",")));
        }
        return String.join("|", parts);
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize attributes for signature", e);
        }
    }
}
