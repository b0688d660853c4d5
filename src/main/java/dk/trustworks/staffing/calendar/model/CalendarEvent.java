package dk.trustworks.staffing.calendar.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class CalendarEvent {

    String id;
    String name;
    LocalDate date;
    CalendarEventType type;
    String location;

    /**
     * True when this event makes {@code date} a day off for someone based in {@code resourceLocation}.
     * A local holiday never matches a resource without a location.
     */
    public boolean closes(String resourceLocation) {
        if (type == null) return false;
        if (type.isCompanyWide()) return true;
        return resourceLocation != null && resourceLocation.equals(location);
    }
}
