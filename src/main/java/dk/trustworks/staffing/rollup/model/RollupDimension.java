package dk.trustworks.staffing.rollup.model;

/**
 * Grouping keys a rollup level can use. {@link #NONE} on its own gives a flat
 * per-resource table.
 */
public enum RollupDimension {

    RESOURCE,
    PROJECT,
    CLIENT,
    CONTRACT,
    LOCATION,
    HORIZONTAL,
    NONE
}
