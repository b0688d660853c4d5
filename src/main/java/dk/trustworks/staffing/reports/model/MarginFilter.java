package dk.trustworks.staffing.reports.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Restricts a margin report to matching projects. Unset fields match everything,
 * set fields must all match.
 */
@Value
@Builder
@Jacksonized
public class MarginFilter {

    String clientId;
    String projectId;
    String wbsCode;

    public static MarginFilter none() {
        return MarginFilter.builder().build();
    }
}
