package com.ciro.markup.ast;

import com.ciro.markup.MarkupValidationException;

public record TextNode(String value, NodeMetadata metadata) implements MarkupNode {

    public TextNode {
        MarkupValidationException.requireNonNull(value, "value");
        MarkupValidationException.requireNonNull(metadata, "metadata");
    }

    @Override
    public NodeType type() {
        return NodeType.TEXT;
    }
}
