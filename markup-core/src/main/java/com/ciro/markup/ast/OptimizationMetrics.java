package com.ciro.markup.ast;

public record OptimizationMetrics(Ratio nodeReduction, Ratio memoryUsage, StateClassStats stateClasses) {
}
