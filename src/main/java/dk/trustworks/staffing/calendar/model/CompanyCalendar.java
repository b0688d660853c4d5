package dk.trustworks.staffing.calendar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Company calendar indexed by date. Read-only once built.
 */
@EqualsAndHashCode(of = "events")
public final class CompanyCalendar {

    private static final CompanyCalendar EMPTY = new CompanyCalendar(List.of());

    private final List<CalendarEvent> events;
    private final Map<LocalDate, List<CalendarEvent>> eventsByDate;

    private CompanyCalendar(Collection<CalendarEvent> events) {
        this.events = List.copyOf(events);
        Map<LocalDate, List<CalendarEvent>> index = new HashMap<>();
        for (CalendarEvent event : this.events) {
            if (event.getDate() == null) continue;
            index.computeIfAbsent(event.getDate(), d -> new ArrayList<>()).add(event);
        }
        index.replaceAll((date, list) -> List.copyOf(list));
        this.eventsByDate = Collections.unmodifiableMap(index);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CompanyCalendar of(Collection<CalendarEvent> events) {
        if (events == null || events.isEmpty()) return EMPTY;
        return new CompanyCalendar(events);
    }

    public static CompanyCalendar empty() {
        return EMPTY;
    }

    @JsonValue
    public List<CalendarEvent> getEvents() {
        return events;
    }

    public List<CalendarEvent> eventsOn(LocalDate date) {
        return eventsByDate.getOrDefault(date, List.of());
    }
}
