package com.ciro.markup.token;

public enum TokenType {
    START_TAG,
    END_TAG,
    TEXT,
    COMMENT,
    DOCTYPE,
    CDATA,
    EOF
}
