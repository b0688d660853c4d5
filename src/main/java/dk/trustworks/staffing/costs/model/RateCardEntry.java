package dk.trustworks.staffing.costs.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class RateCardEntry {

    String resourceId;
    BigDecimal dailyRate;
}
