package dk.trustworks.staffing.model;

public enum BillingType {

    /**
     * Revenue follows the allocated days at the contract's rate card.
     */
    TIME_MATERIAL,

    /**
     * Revenue comes only from billing milestones.
     */
    FIXED_PRICE
}
