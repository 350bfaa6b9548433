package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

public record EndTagToken(SourceSpan span, String name, String namespace) implements Token {

    public EndTagToken {
        MarkupValidationException.requireNonNull(span, "span");
        MarkupValidationException.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new MarkupValidationException("end tag name must not be empty");
        }
    }

    @Override
    public TokenType type() {
        return TokenType.END_TAG;
    }
}
