package dk.trustworks.staffing.forecast.model;

public enum ProjectionState {

    /**
     * Past or current month, or a future month that already has allocation entries.
     */
    ACTUAL,

    /**
     * Future month without entries, extrapolated from the recent run-rate.
     */
    PROJECTED,

    /**
     * Nothing to extrapolate, or the resource or project is not active in the month.
     */
    NONE
}
