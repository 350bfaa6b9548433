package com.ciro.markup.token;

/**
 * Unidad léxica producida por {@link MarkupTokenizer}. Los tokens son inmutables.
 */
public sealed interface Token
        permits StartTagToken, EndTagToken, TextToken, CommentToken, DoctypeToken, CdataToken, EofToken {

    TokenType type();

    SourceSpan span();

    default int start() {
        return span().start();
    }

    default int end() {
        return span().end();
    }
}
