package com.ciro.markup.ast;

import com.ciro.markup.MarkupValidationException;

public record CommentNode(String value, NodeMetadata metadata) implements MarkupNode {

    public CommentNode {
        MarkupValidationException.requireNonNull(value, "value");
        MarkupValidationException.requireNonNull(metadata, "metadata");
    }

    @Override
    public NodeType type() {
        return NodeType.COMMENT;
    }
}
