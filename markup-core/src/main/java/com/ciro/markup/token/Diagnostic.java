package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

/**
 * Problema no fatal encontrado al tokenizar o al construir el árbol.
 * Nunca interrumpe el proceso: se acumula y se devuelve junto al resultado.
 */
public record Diagnostic(String message, Severity severity, int line, int column, int start, int end) {

    public Diagnostic {
        MarkupValidationException.requireNonNull(message, "message");
        MarkupValidationException.requireNonNull(severity, "severity");
    }

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, Severity.ERROR, span.line(), span.column(), span.start(), span.end());
    }

    public static Diagnostic warning(String message, SourceSpan span) {
        return new Diagnostic(message, Severity.WARNING, span.line(), span.column(), span.start(), span.end());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
