package dk.trustworks.staffing.allocation.model;

import dk.trustworks.staffing.utils.DateUtils;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Objects;

/**
 * Closed date interval, both ends inclusive. A {@code null} bound is open
 * (minus or plus infinity). An interval whose start is after its end is empty.
 */
@Getter
@EqualsAndHashCode
public final class DateWindow {

    private static final DateWindow UNBOUNDED = new DateWindow(null, null);

    private final LocalDate start;
    private final LocalDate end;

    private DateWindow(LocalDate start, LocalDate end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Bounded window, both dates required.
     */
    public static DateWindow of(LocalDate start, LocalDate end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        return new DateWindow(start, end);
    }

    /**
     * Window where either bound may be missing.
     */
    public static DateWindow between(LocalDate start, LocalDate end) {
        if (start == null && end == null) return UNBOUNDED;
        return new DateWindow(start, end);
    }

    public static DateWindow unbounded() {
        return UNBOUNDED;
    }

    public static DateWindow ofMonth(YearMonth month) {
        return new DateWindow(DateUtils.getFirstDayOfMonth(month), DateUtils.getLastDayOfMonth(month));
    }

    public boolean isBounded() {
        return start != null && end != null;
    }

    public boolean isEmpty() {
        return start != null && end != null && start.isAfter(end);
    }

    public boolean contains(LocalDate date) {
        if (start != null && date.isBefore(start)) return false;
        return end == null || !date.isAfter(end);
    }

    public DateWindow intersect(DateWindow other) {
        if (other == null) return this;
        return between(DateUtils.max(start, other.start), DateUtils.min(end, other.end));
    }

    public boolean overlaps(DateWindow other) {
        return !intersect(other).isEmpty();
    }

    /**
     * Calendar months touched by this window, in order. Only defined for bounded windows.
     */
    public List<YearMonth> months() {
        if (!isBounded()) throw new IllegalStateException("Cannot split an unbounded window into months: " + this);
        return DateUtils.getMonthsInPeriod(start, end);
    }

    @Override
    public String toString() {
        return "[" + (start == null ? "-inf" : DateUtils.stringIt(start)) + ", " + (end == null ? "+inf" : DateUtils.stringIt(end)) + "]";
    }
}
