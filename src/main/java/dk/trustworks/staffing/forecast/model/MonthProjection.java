package dk.trustworks.staffing.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MonthProjection {

    YearMonth month;
    ProjectionState state;
    BigDecimal personDays;
    // person-days per working day, only set for PROJECTED
    BigDecimal runRate;

    public static MonthProjection actual(YearMonth month, BigDecimal personDays) {
        return new MonthProjection(month, ProjectionState.ACTUAL, personDays, null);
    }

    public static MonthProjection projected(YearMonth month, BigDecimal personDays, BigDecimal runRate) {
        return new MonthProjection(month, ProjectionState.PROJECTED, personDays, runRate);
    }

    public static MonthProjection none(YearMonth month) {
        return new MonthProjection(month, ProjectionState.NONE, BigDecimal.ZERO, null);
    }
}
