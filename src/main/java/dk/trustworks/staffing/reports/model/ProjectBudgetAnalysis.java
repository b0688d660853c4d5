package dk.trustworks.staffing.reports.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ProjectBudgetAnalysis {

    String projectId;
    String projectName;
    String clientId;
    BigDecimal budget;
    BigDecimal estimatedCost;
    // budget minus estimated cost, negative when over budget
    BigDecimal variance;
    BigDecimal consumptionPercentage;

    public boolean isOverBudget() {
        return variance.signum() < 0;
    }
}
