package com.ciro.markup.ast;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"equivalenceClass", "isMinimized"})
public record NodeMetadata(int equivalenceClass, @JsonProperty("isMinimized") boolean minimized) {

    /** Metadatos de la raíz sintética */
    public static final NodeMetadata ROOT = new NodeMetadata(0, false);

    public static NodeMetadata tagged(int equivalenceClass) {
        return new NodeMetadata(equivalenceClass, true);
    }

    public NodeMetadata asMinimized() {
        return minimized ? this : new NodeMetadata(equivalenceClass, true);
    }
}
