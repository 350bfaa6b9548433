package com.ciro.markup.ast;

import java.util.List;
import java.util.Map;

public sealed interface MarkupNode permits ElementNode, TextNode, CommentNode {

    NodeType type();

    NodeMetadata metadata();

    default String name() {
        return null;
    }

    default String value() {
        return null;
    }

    default Map<String, String> attributes() {
        return Map.of();
    }

    default List<MarkupNode> children() {
        return List.of();
    }
}
