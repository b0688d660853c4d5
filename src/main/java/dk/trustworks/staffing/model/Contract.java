package dk.trustworks.staffing.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Contract or cost-center. Groups projects under a WBS code and carries the rate card
 * their time and material revenue is priced with. The ceiling ({@code capienza}) is
 * carried for callers that compute backlog.
 */
@Value
@Builder
@Jacksonized
public class Contract {

    String id;
    String name;
    String wbsCode;
    String rateCardId;
    BillingType billingType;

    @Builder.Default
    BigDecimal capienza = BigDecimal.ZERO;

    @JsonIgnore
    public String getLabel() {
        if (wbsCode == null || wbsCode.isBlank()) return name;
        return wbsCode + " - " + name;
    }
}
