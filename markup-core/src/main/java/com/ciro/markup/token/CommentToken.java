package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

/**
 * {@code <!-- ... -->}. El contenido se guarda recortado. Los comentarios
 * condicionales ({@code <!--[if IE]>...<![endif]-->}) llevan su condición.
 */
public record CommentToken(SourceSpan span, String content, boolean conditional, String condition) implements Token {

    public CommentToken {
        MarkupValidationException.requireNonNull(span, "span");
        MarkupValidationException.requireNonNull(content, "content");
        if (conditional && condition == null) {
            throw new MarkupValidationException("conditional comment requires a condition");
        }
    }

    public CommentToken(SourceSpan span, String content) {
        this(span, content, false, null);
    }

    @Override
    public TokenType type() {
        return TokenType.COMMENT;
    }
}
