package com.ciro.markup.ast;

/** Antes / después y {@code ratio = optimized / original}. */
public record Ratio(long original, long optimized, double ratio) {

    public static Ratio of(long original, long optimized) {
        double ratio = original == 0 ? Double.NaN : (double) optimized / original;
        return new Ratio(original, optimized, ratio);
    }
}
