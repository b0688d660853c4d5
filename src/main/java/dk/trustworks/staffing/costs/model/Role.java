package dk.trustworks.staffing.costs.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Role {

    String id;
    String name;

    @Builder.Default
    RoleCostHistory costHistory = RoleCostHistory.empty();
}
