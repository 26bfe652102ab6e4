package com.processflow.core.model;

/**
 * Canvas coordinates of a node. Presentation only; the engine never reads it.
 */
public record Position(double x, double y) {

    public static Position origin() {
        return new Position(0, 0);
    }
}
