package dk.trustworks.staffing.costs.services;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Daily cost of a role as it was on a given date.
 */
@FunctionalInterface
public interface RoleCostResolver {

    /**
     * @return the daily cost valid on {@code date}, zero when unknown
     */
    BigDecimal dailyCost(String roleId, LocalDate date);
}
