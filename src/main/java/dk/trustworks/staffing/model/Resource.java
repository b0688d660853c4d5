package dk.trustworks.staffing.model;

import dk.trustworks.staffing.allocation.model.DateWindow;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * A person that can be staffed on projects.
 *
 * <p>The effective window runs from {@code hireDate} up to and including
 * {@code lastDayOfWork}. A resignation day still counts as worked.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Resource {

    String id;
    String name;
    String location;
    String roleId;
    String horizontal;
    LocalDate hireDate;
    LocalDate lastDayOfWork;

    @Builder.Default
    int maxStaffingPercentage = 100;

    boolean resigned;

    @JsonIgnore
    public DateWindow effectiveWindow() {
        return DateWindow.between(hireDate, lastDayOfWork);
    }
}
