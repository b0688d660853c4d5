package dk.trustworks.staffing.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Amount billed on a fixed-price project at a given date. Counts as revenue in the
 * month of its date whatever its status.
 */
@Value
@Builder
@Jacksonized
public class BillingMilestone {

    String id;
    String projectId;
    String name;
    LocalDate date;

    @Builder.Default
    BigDecimal amount = BigDecimal.ZERO;

    @Builder.Default
    MilestoneStatus status = MilestoneStatus.PLANNED;
}
