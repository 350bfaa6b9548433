package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

public record EofToken(SourceSpan span) implements Token {

    public EofToken {
        MarkupValidationException.requireNonNull(span, "span");
        if (span.length() != 0) {
            throw new MarkupValidationException("EOF token must be empty, got " + span);
        }
    }

    @Override
    public TokenType type() {
        return TokenType.EOF;
    }
}
