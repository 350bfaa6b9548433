package com.ciro.markup.fsm;

public record MinimizationMetrics(int originalStateCount, int minimizedStateCount, double optimizationRatio) {

    public static MinimizationMetrics of(int original, int minimized) {
        double ratio = original == 0 ? 1.0 : (double) minimized / original;
        return new MinimizationMetrics(original, minimized, ratio);
    }
}
