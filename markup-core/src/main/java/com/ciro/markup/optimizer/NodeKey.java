package com.ciro.markup.optimizer;

import com.ciro.markup.ast.NodeMetadata;
import com.ciro.markup.ast.NodeType;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Clave de contenido de un nodo ya optimizado. Se construye de abajo hacia arriba
 * a partir de las claves de los hijos, con el hash precalculado para que la
 * búsqueda en la memo no recorra el subárbol.
 * <p>
 * Las claves de los hijos ya están internadas en {@link OptimizationContext},
 * así que se comparan por referencia: {@code equals} nunca desciende.
 */
final class NodeKey {

    private final NodeType type;
    private final String name;
    private final String value;
    private final Map<String, String> attributes;
    private final NodeMetadata metadata;
    private final List<NodeKey> children;
    private final int hash;

    private NodeKey(NodeType type, String name, String value, Map<String, String> attributes,
                    NodeMetadata metadata, List<NodeKey> children) {
        this.type = type;
        this.name = name;
        this.value = value;
        this.attributes = new TreeMap<>(attributes);
        this.metadata = metadata;
        this.children = List.copyOf(children);
        this.hash = Objects.hash(type, name, value, this.attributes, metadata, this.children);
    }

    static NodeKey leaf(NodeType type, String value, NodeMetadata metadata) {
        return new NodeKey(type, null, value, Map.of(), metadata, List.of());
    }

    static NodeKey element(String name, Map<String, String> attributes, NodeMetadata metadata, List<NodeKey> children) {
        return new NodeKey(NodeType.ELEMENT, name, null, attributes, metadata, children);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeKey other)) return false;
        return hash == other.hash
                && type == other.type
                && Objects.equals(name, other.name)
                && Objects.equals(value, other.value)
                && attributes.equals(other.attributes)
                && metadata.equals(other.metadata)
                && sameChildren(children, other.children);
    }

    private static boolean sameChildren(List<NodeKey> a, List<NodeKey> b) {
        if (a.size() != b.size()) return false;
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
