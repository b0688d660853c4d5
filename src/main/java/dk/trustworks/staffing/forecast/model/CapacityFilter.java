package dk.trustworks.staffing.forecast.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Narrows a capacity forecast to part of the workforce. All fields are optional.
 * When both are given, the project wins over the client.
 */
@Value
@Builder
@Jacksonized
public class CapacityFilter {

    private static final CapacityFilter NONE = CapacityFilter.builder().build();

    String horizontal;
    String clientId;
    String projectId;

    public static CapacityFilter none() {
        return NONE;
    }
}
