package dk.trustworks.staffing.reports.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class UtilizationFilter {

    private static final UtilizationFilter NONE = UtilizationFilter.builder().build();

    String roleId;
    String horizontal;

    public static UtilizationFilter none() {
        return NONE;
    }
}
