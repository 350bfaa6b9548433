package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

/**
 * Texto crudo entre etiquetas. {@code significant} indica si el constructor del
 * árbol debe conservarlo: siempre para texto no vacío, y para texto en blanco
 * solo con {@code preserveWhitespace}.
 */
public record TextToken(SourceSpan span, String content, boolean significant) implements Token {

    public TextToken {
        MarkupValidationException.requireNonNull(span, "span");
        MarkupValidationException.requireNonNull(content, "content");
    }

    public boolean isWhitespace() {
        return content.isBlank();
    }

    @Override
    public TokenType type() {
        return TokenType.TEXT;
    }
}
