package dk.trustworks.staffing.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
@Builder
public class CapacityForecastMonth {

    YearMonth month;
    int resourceCount;
    BigDecimal availablePersonDays;
    BigDecimal allocatedPersonDays;
    // part of allocatedPersonDays that is extrapolated rather than planned
    BigDecimal projectedPersonDays;
    BigDecimal utilizationPercentage;
    // negative when the month is overbooked
    BigDecimal surplusDeficit;

    public boolean isOverbooked() {
        return surplusDeficit.signum() < 0;
    }
}
