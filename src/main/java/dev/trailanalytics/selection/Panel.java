package dev.trailanalytics.selection;

/**
 * A view of the application: the selection it reads and the sort state of its tables.
 *
 * @param name panel name
 * @param selection the selection context, possibly shared with other panels
 * @param sorts sort spec per table of this panel
 * @param normalizeFemale whether the panel compares sexes on the normalized scale
 */
public record Panel(
    String name, SelectionContext selection, SortState sorts, boolean normalizeFemale) {}
