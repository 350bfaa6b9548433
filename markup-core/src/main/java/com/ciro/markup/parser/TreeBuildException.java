package com.ciro.markup.parser;

import com.ciro.markup.token.Token;

/**
 * Un token no se pudo aplicar al estado actual del árbol.
 * El constructor la captura por token; nunca aborta el parse completo.
 */
public class TreeBuildException extends RuntimeException {

    private final transient Token token;

    public TreeBuildException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
