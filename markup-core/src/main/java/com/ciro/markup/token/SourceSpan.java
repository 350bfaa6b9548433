package com.ciro.markup.token;

import com.ciro.markup.MarkupValidationException;

/**
 * Rango {@code [start, end)} en la entrada, más la línea y columna (base 1)
 * del primer carácter.
 */
public record SourceSpan(int start, int end, int line, int column) {

    public SourceSpan {
        if (start < 0) {
            throw new MarkupValidationException("start must be >= 0, got " + start);
        }
        if (end < start) {
            throw new MarkupValidationException("end (" + end + ") must be >= start (" + start + ")");
        }
        if (line < 1 || column < 1) {
            throw new MarkupValidationException("line and column are 1-based, got " + line + ":" + column);
        }
    }

    public int length() {
        return end - start;
    }
}
