package com.ciro.markup.optimizer;

import com.ciro.markup.ast.MarkupNode;

import java.util.List;

/**
 * Grupo de nodos (más de uno) con la misma firma estructural.
 * Solo se usa para reportar; no implica compartir estructura.
 */
public record StateClass(int id, String signature, List<MarkupNode> members) {

    public StateClass {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
