package dev.trailanalytics.compare;

/**
 * A generated CSV document.
 *
 * @param fileName suggested file name
 * @param content the CSV text
 */
public record CsvExport(String fileName, String content) {}
