package dk.trustworks.staffing.costs.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Daily sell rates per resource, attached to a contract.
 */
@Value
@Builder
@Jacksonized
public class RateCard {

    String id;
    String name;
    String currency;

    @Builder.Default
    List<RateCardEntry> entries = List.of();
}
