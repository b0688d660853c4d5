package dk.trustworks.staffing.reports.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
@Builder
public class MonthlyMargin {

    YearMonth month;
    BigDecimal revenue;
    BigDecimal cost;
    BigDecimal margin;
    // margin over revenue, zero without revenue
    BigDecimal marginPercentage;
}
