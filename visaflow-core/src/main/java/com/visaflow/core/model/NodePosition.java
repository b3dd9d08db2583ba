package com.visaflow.core.model;

/**
 * Position of a node on the designer canvas. Not used by execution.
 */
public record NodePosition(double x, double y) {

    public static final NodePosition ORIGIN = new NodePosition(0, 0);
}
