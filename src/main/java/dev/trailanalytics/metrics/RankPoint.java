package dev.trailanalytics.metrics;

/** One point of a rank curve. */
public record RankPoint(int rank, double score) {}
