package com.ciro.markup.ast;

import java.util.OptionalDouble;

/**
 * {@code averageSize} queda vacío cuando no hay clases (0/0 no es cero).
 */
public record StateClassStats(int count, OptionalDouble averageSize) {

    public static StateClassStats of(int count, int totalMembers) {
        return new StateClassStats(count,
                count == 0 ? OptionalDouble.empty() : OptionalDouble.of((double) totalMembers / count));
    }
}
