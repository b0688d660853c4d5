package dk.trustworks.staffing.calendar.services;

import dk.trustworks.staffing.calendar.model.CalendarEvent;
import dk.trustworks.staffing.calendar.model.CompanyCalendar;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.utils.DateUtils;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Working-day arithmetic against the company calendar.
 *
 * <p>A date is a day off when it falls on a weekend, on a national holiday or
 * company closure, or on a local holiday of the resource's own location.
 */
@ApplicationScoped
public class CalendarService {

    public boolean isWorkingDay(LocalDate date, String location, CompanyCalendar calendar) {
        if (DateUtils.isWeekendDay(date)) return false;
        if (calendar == null) return true;
        for (CalendarEvent event : calendar.eventsOn(date)) {
            if (event.closes(location)) return false;
        }
        return true;
    }

    /**
     * @param start inclusive
     * @param end inclusive
     * @return number of working days, 0 when start is after end
     */
    public int workingDaysBetween(LocalDate start, LocalDate end, CompanyCalendar calendar, String location) {
        if (start == null || end == null || start.isAfter(end)) return 0;
        int workingDays = 0;
        LocalDate date = start;
        while (!date.isAfter(end)) {
            if (isWorkingDay(date, location, calendar)) workingDays++;
            date = date.plusDays(1);
        }
        return workingDays;
    }

    public int workingDaysIn(DateWindow window, CompanyCalendar calendar, String location) {
        if (!window.isBounded()) throw new IllegalArgumentException("Working days are only countable in a bounded window: " + window);
        return workingDaysBetween(window.getStart(), window.getEnd(), calendar, location);
    }

    /**
     * The working dates of the period, used when a percentage is spread over a range
     * so that weekends and holidays never receive an allocation.
     *
     * @param start inclusive
     * @param end inclusive
     */
    public List<LocalDate> workingDates(LocalDate start, LocalDate end, CompanyCalendar calendar, String location) {
        List<LocalDate> dates = new ArrayList<>();
        if (start == null || end == null || start.isAfter(end)) return dates;
        LocalDate date = start;
        while (!date.isAfter(end)) {
            if (isWorkingDay(date, location, calendar)) dates.add(date);
            date = date.plusDays(1);
        }
        return dates;
    }
}
