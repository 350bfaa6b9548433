package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

public record CdataToken(SourceSpan span, String content) implements Token {

    public CdataToken {
        MarkupValidationException.requireNonNull(span, "span");
        MarkupValidationException.requireNonNull(content, "content");
    }

    @Override
    public TokenType type() {
        return TokenType.CDATA;
    }
}
