package com.ciro.markup;

/**
 * Se lanza cuando un token o un nodo se construye con una forma inválida
 * (campo obligatorio nulo, posiciones negativas, etc.). Es fatal solo para
 * la llamada que lo construye.
 */
public class MarkupValidationException extends IllegalArgumentException {

    public MarkupValidationException(String message) {
        super(message);
    }

    public static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new MarkupValidationException(field + " must not be null");
        }
        return value;
    }
}
