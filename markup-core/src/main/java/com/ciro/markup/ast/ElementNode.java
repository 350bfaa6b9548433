package com.ciro.markup.ast;

import com.ciro.markup.MarkupValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Elemento del árbol. Hay dos variantes:
 * <ul>
 *   <li>{@link #open}: lista de hijos mutable, usada mientras se construye el árbol.</li>
 *   <li>{@link #readOnly}: hijos y atributos inmutables; cualquier escritura lanza
 *       {@link UnsupportedOperationException}.</li>
 * </ul>
 * Los atributos nunca se modifican después de crear el nodo.
 */
public final class ElementNode implements MarkupNode {

    private final String name;
    private final Map<String, String> attributes;
    private final List<MarkupNode> children;
    private final NodeMetadata metadata;
    private final boolean readOnly;

    private ElementNode(String name, Map<String, String> attributes, List<MarkupNode> children,
                        NodeMetadata metadata, boolean readOnly) {
        MarkupValidationException.requireNonNull(name, "name");
        MarkupValidationException.requireNonNull(attributes, "attributes");
        MarkupValidationException.requireNonNull(metadata, "metadata");
        if (name.isBlank()) {
            throw new MarkupValidationException("element name must not be blank");
        }
        this.name = name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = children;
        this.metadata = metadata;
        this.readOnly = readOnly;
    }

    public static ElementNode open(String name, Map<String, String> attributes, NodeMetadata metadata) {
        return new ElementNode(name, attributes, new ArrayList<>(), metadata, false);
    }

    public static ElementNode readOnly(String name, Map<String, String> attributes,
                                       List<MarkupNode> children, NodeMetadata metadata) {
        MarkupValidationException.requireNonNull(children, "children");
        return new ElementNode(name, attributes, List.copyOf(children), metadata, true);
    }

    public void appendChild(MarkupNode child) {
        MarkupValidationException.requireNonNull(child, "child");
        children.add(child);
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public NodeType type() {
        return NodeType.ELEMENT;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, String> attributes() {
        return attributes;
    }

    @Override
    public List<MarkupNode> children() {
        return readOnly ? children : Collections.unmodifiableList(children);
    }

    @Override
    public NodeMetadata metadata() {
        return metadata;
    }

    @Override
    public String toString() {
        // Sin descender: un árbol profundo no debe agotar la pila al imprimirse
        return "Element(" + name + ")" + attributes + "[" + children.size() + " children]";
    }
}
