package dk.trustworks.staffing.allocation.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Person-days and cost of an allocation over a window. Cost is zero when no cost
 * resolver took part in the calculation.
 */
@Value
public class AllocationAggregate {

    public static final AllocationAggregate ZERO = new AllocationAggregate(BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal personDays;
    BigDecimal cost;

    public AllocationAggregate plus(AllocationAggregate other) {
        return new AllocationAggregate(personDays.add(other.personDays), cost.add(other.cost));
    }
}
