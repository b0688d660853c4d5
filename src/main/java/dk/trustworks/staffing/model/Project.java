package dk.trustworks.staffing.model;

import dk.trustworks.staffing.allocation.model.DateWindow;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Project {

    String id;
    String name;
    String clientId;
    String contractId;
    String status;
    LocalDate startDate;
    LocalDate endDate;

    // falls back to the contract's billing type when not set
    BillingType billingType;

    @Builder.Default
    BigDecimal budget = BigDecimal.ZERO;

    // billing adjustment applied to raw cost, 100 means no adjustment
    @Builder.Default
    BigDecimal realizationPercentage = BigDecimal.valueOf(100);

    /**
     * Missing start or end dates leave that side open.
     */
    @JsonIgnore
    public DateWindow window() {
        return DateWindow.between(startDate, endDate);
    }
}
