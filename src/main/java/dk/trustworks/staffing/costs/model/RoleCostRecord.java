package dk.trustworks.staffing.costs.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One row of a role's cost history. {@code endDate} is the last day the cost applies,
 * {@code null} while the record is the open one.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoleCostRecord {

    BigDecimal dailyCost;
    LocalDate startDate;
    LocalDate endDate;

    @JsonIgnore
    public boolean isOpen() {
        return endDate == null;
    }

    public boolean covers(LocalDate date) {
        if (startDate != null && date.isBefore(startDate)) return false;
        return endDate == null || !date.isAfter(endDate);
    }
}
