package com.ciro.markup.optimizer;

import com.ciro.markup.ast.MarkupNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Estimación aproximada de memoria: overhead fijo por nodo + 2 bytes por carácter
 * de tipo/nombre/valor/atributos + el JSON de los metadatos.
 */
final class MemoryEstimator {

    static final int NODE_OVERHEAD = 40;
    static final int BYTES_PER_CHAR = 2;

    private final ObjectMapper mapper;

    MemoryEstimator(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Totales de un recorrido completo (incluida la raíz). */
    record Totals(long nodes, long bytes) {}

    Totals walk(MarkupNode root) {
        long nodes = 0;
        long bytes = 0;
        Deque<MarkupNode> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            MarkupNode node = pending.pop();
            nodes++;
            bytes += estimate(node);
            for (MarkupNode child : node.children()) {
                pending.push(child);
            }
        }
        return new Totals(nodes, bytes);
    }

    long estimate(MarkupNode node) {
        long chars = node.type().label().length() + length(node.name()) + length(node.value());
        for (Map.Entry<String, String> attr : node.attributes().entrySet()) {
            chars += length(attr.getKey()) + length(attr.getValue());
        }
        return NODE_OVERHEAD + BYTES_PER_CHAR * (chars + metadataLength(node));
    }

    private long metadataLength(MarkupNode node) {
        try {
            return mapper.writeValueAsString(node.metadata()).length();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize node metadata", e);
        }
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }
}
