package dev.trailanalytics.metrics;

/**
 * One point of a Lorenz curve.
 *
 * @param populationShare cumulative share of finishers, lowest scores first, in [0, 1]
 * @param scoreShare cumulative share of the total score held by that population, in [0, 1]
 */
public record LorenzPoint(double populationShare, double scoreShare) {}
