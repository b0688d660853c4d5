package dk.trustworks.staffing.allocation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import dk.trustworks.staffing.exceptions.MalformedAllocationException;
import dk.trustworks.staffing.utils.DateUtils;
import lombok.EqualsAndHashCode;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sparse day-by-day allocation of one assignment, in percent of a working day.
 *
 * <p>Keys are real dates, ordered. A missing date means "not allocated that day".
 * Percentages are kept as given, negative or above 100 included.
 */
@EqualsAndHashCode(of = "percentages")
public final class Allocation {

    private static final Allocation EMPTY = new Allocation(new TreeMap<>());

    private final NavigableMap<LocalDate, Integer> percentages;

    private Allocation(TreeMap<LocalDate, Integer> percentages) {
        this.percentages = Collections.unmodifiableNavigableMap(percentages);
    }

    public static Allocation empty() {
        return EMPTY;
    }

    /**
     * Builds an allocation from ISO keys (yyyy-MM-dd) as stored upstream.
     *
     * @throws MalformedAllocationException on the first key that is not a valid ISO date
     *                                      or whose percentage is missing
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Allocation fromIsoMap(Map<String, Integer> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        TreeMap<LocalDate, Integer> parsed = new TreeMap<>();
        for (Map.Entry<String, Integer> entry : raw.entrySet()) {
            LocalDate date = parseKey(entry.getKey());
            if (entry.getValue() == null) {
                throw new MalformedAllocationException(entry.getKey(), "Allocation on " + entry.getKey() + " has no percentage");
            }
            parsed.put(date, entry.getValue());
        }
        return new Allocation(parsed);
    }

    public static Allocation of(Map<LocalDate, Integer> percentages) {
        if (percentages == null || percentages.isEmpty()) return EMPTY;
        TreeMap<LocalDate, Integer> copy = new TreeMap<>();
        percentages.forEach((date, percentage) -> {
            Objects.requireNonNull(date, "date");
            if (percentage == null) {
                throw new MalformedAllocationException(date.toString(), "Allocation on " + date + " has no percentage");
            }
            copy.put(date, percentage);
        });
        return new Allocation(copy);
    }

    private static LocalDate parseKey(String key) {
        try {
            LocalDate date = DateUtils.dateIt(key);
            if (date == null) throw new MalformedAllocationException(key, "Allocation key is blank");
            return date;
        } catch (DateTimeParseException e) {
            throw new MalformedAllocationException(key, "Allocation key '" + key + "' is not an ISO date (yyyy-MM-dd)", e);
        }
    }

    @JsonIgnore
    public boolean isEmpty() {
        return percentages.isEmpty();
    }

    public int size() {
        return percentages.size();
    }

    public Integer percentageOn(LocalDate date) {
        return percentages.get(date);
    }

    /**
     * Entries inside the window, in date order. Open bounds are honoured.
     */
    public NavigableMap<LocalDate, Integer> entriesIn(DateWindow window) {
        if (window.isEmpty()) return Collections.emptyNavigableMap();
        NavigableMap<LocalDate, Integer> view = percentages;
        if (window.getStart() != null) view = view.tailMap(window.getStart(), true);
        if (window.getEnd() != null) view = view.headMap(window.getEnd(), true);
        return view;
    }

    public boolean hasEntriesIn(YearMonth month) {
        return !entriesIn(DateWindow.ofMonth(month)).isEmpty();
    }

    /**
     * A copy of this allocation with {@code percentage} set on every given date.
     */
    public Allocation withPercentage(Collection<LocalDate> dates, int percentage) {
        TreeMap<LocalDate, Integer> copy = new TreeMap<>(percentages);
        for (LocalDate date : dates) copy.put(date, percentage);
        return new Allocation(copy);
    }

    /**
     * Canonical ISO representation, date ordered.
     */
    @JsonValue
    public Map<String, Integer> toIsoMap() {
        Map<String, Integer> iso = new LinkedHashMap<>();
        percentages.forEach((date, percentage) -> iso.put(DateUtils.stringIt(date), percentage));
        return iso;
    }

    @Override
    public String toString() {
        return "Allocation" + toIsoMap();
    }
}
