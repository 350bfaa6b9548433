package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code <name attr="v" ...>}. El nombre y las claves de atributo ya vienen en minúsculas.
 * {@code namespace} solo se rellena en modo XML ({@code ns:local}).
 */
public record StartTagToken(SourceSpan span, String name, String namespace,
                            Map<String, String> attributes, boolean selfClosing) implements Token {

    public StartTagToken {
        MarkupValidationException.requireNonNull(span, "span");
        MarkupValidationException.requireNonNull(name, "name");
        MarkupValidationException.requireNonNull(attributes, "attributes");
        if (name.isEmpty()) {
            throw new MarkupValidationException("start tag name must not be empty");
        }
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @Override
    public TokenType type() {
        return TokenType.START_TAG;
    }
}
