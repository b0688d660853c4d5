package dk.trustworks.staffing.reports.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Total allocation of one resource on one working day, summed over all its assignments.
 */
@Value
public class DailyLoad {

    String resourceId;
    LocalDate date;
    int totalPercentage;
    int maxStaffingPercentage;
    // percentage per project id
    Map<String, Integer> breakdown;

    public DailyLoad(String resourceId, LocalDate date, int totalPercentage, int maxStaffingPercentage, Map<String, Integer> breakdown) {
        this.resourceId = resourceId;
        this.date = date;
        this.totalPercentage = totalPercentage;
        this.maxStaffingPercentage = maxStaffingPercentage;
        this.breakdown = Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }

    public boolean isOverAllocated() {
        return totalPercentage > maxStaffingPercentage;
    }

    public int getExcessPercentage() {
        return Math.max(0, totalPercentage - maxStaffingPercentage);
    }
}
