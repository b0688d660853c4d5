package dk.trustworks.staffing.reports.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * One resource in the monthly utilization report. Available days already account for
 * the resource's staffing cap.
 */
@Value
@Builder
public class UtilizationRow {

    String resourceId;
    String resourceName;
    String roleId;
    String horizontal;
    YearMonth month;
    int workingDays;
    BigDecimal availableDays;
    BigDecimal allocatedDays;
    BigDecimal allocatedCost;
    BigDecimal utilizationPercentage;
}
