package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

public record DoctypeToken(SourceSpan span, String name, String remainder) implements Token {

    public DoctypeToken {
        MarkupValidationException.requireNonNull(span, "span");
        MarkupValidationException.requireNonNull(name, "name");
        if (remainder == null) remainder = "";
    }

    @Override
    public TokenType type() {
        return TokenType.DOCTYPE;
    }
}
