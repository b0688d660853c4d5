package dk.trustworks.staffing.reports.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * A resource whose total allocation exceeds its staffing cap on at least one working day.
 */
@Value
public class OverAllocation {

    String resourceId;
    String resourceName;
    int maxStaffingPercentage;
    List<DailyLoad> overAllocatedDays;

    public LocalDate getFirstDate() {
        return overAllocatedDays.get(0).getDate();
    }

    public int getPeakPercentage() {
        return overAllocatedDays.stream().mapToInt(DailyLoad::getTotalPercentage).max().orElse(0);
    }
}
