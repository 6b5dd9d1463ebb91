package dev.trailanalytics.compare;

/**
 * A ladder point and its RCI distance to a reference point.
 *
 * @param point the neighbouring point
 * @param delta absolute RCI difference to the reference point
 */
public record ClosestMatch(LadderPoint point, double delta) {}
