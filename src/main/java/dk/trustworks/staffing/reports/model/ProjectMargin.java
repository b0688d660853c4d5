package dk.trustworks.staffing.reports.model;

import dk.trustworks.staffing.model.BillingType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Estimated revenue of one project against its labour cost.
 */
@Value
@Builder
public class ProjectMargin {

    String projectId;
    String projectName;
    String clientId;
    BillingType billingType;
    BigDecimal budget;
    BigDecimal personDays;
    BigDecimal cost;
    BigDecimal revenue;
    BigDecimal margin;
    BigDecimal marginPercentage;

    public boolean isLossMaking() {
        return margin.signum() < 0;
    }
}
