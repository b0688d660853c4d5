package dk.trustworks.staffing.allocation.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Link between one resource and one project, carrying its day-by-day allocation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Assignment {

    String id;
    String resourceId;
    String projectId;

    @Builder.Default
    Allocation allocation = Allocation.empty();

    /**
     * Never {@code null}. An explicit {@code "allocation": null} reads as no allocation.
     */
    public Allocation getAllocation() {
        return allocation == null ? Allocation.empty() : allocation;
    }
}
