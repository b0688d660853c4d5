package dk.trustworks.staffing.rollup.model;

/**
 * What a rollup value measures.
 */
public enum RollupUnit {

    /** Person-days. */
    DAYS,

    /** Person-days over a fixed reference month length, an approximation. */
    FTE,

    /** Historic cost with the project's realization applied. */
    COST
}
