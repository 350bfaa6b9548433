package com.ciro.markup.ast;

public enum NodeType {
    ELEMENT("Element"),
    TEXT("Text"),
    COMMENT("Comment");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    /** Nombre usado en firmas estructurales y en la estimación de memoria */
    public String label() {
        return label;
    }
}
