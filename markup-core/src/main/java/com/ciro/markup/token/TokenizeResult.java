package com.ciro.markup.token;

import java.util.List;

public record TokenizeResult(List<Token> tokens, List<Diagnostic> diagnostics) {

    public TokenizeResult {
        tokens = List.copyOf(tokens);
        diagnostics = List.copyOf(diagnostics);
    }
}
