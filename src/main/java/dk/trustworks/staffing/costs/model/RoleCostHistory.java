package dk.trustworks.staffing.costs.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Slowly changing (type 2) cost history of a role, ordered by start date.
 *
 * <p>Expected shape: records do not overlap and only the last one is open. The
 * history does not enforce this, see {@link #isConsistent()}. When records do
 * overlap, {@link #recordOn(LocalDate)} picks the one that started last.
 */
@EqualsAndHashCode
public final class RoleCostHistory {

    private static final Comparator<RoleCostRecord> BY_START = Comparator.comparing(RoleCostRecord::getStartDate,
            Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final RoleCostHistory EMPTY = new RoleCostHistory(List.of());

    private final List<RoleCostRecord> records;

    private RoleCostHistory(Collection<RoleCostRecord> records) {
        List<RoleCostRecord> sorted = new ArrayList<>(records);
        sorted.removeIf(Objects::isNull);
        sorted.sort(BY_START);
        this.records = List.copyOf(sorted);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static RoleCostHistory of(Collection<RoleCostRecord> records) {
        if (records == null || records.isEmpty()) return EMPTY;
        return new RoleCostHistory(records);
    }

    public static RoleCostHistory of(RoleCostRecord... records) {
        return of(List.of(records));
    }

    public static RoleCostHistory empty() {
        return EMPTY;
    }

    @JsonValue
    public List<RoleCostRecord> getRecords() {
        return records;
    }

    public Optional<RoleCostRecord> recordOn(LocalDate date) {
        RoleCostRecord match = null;
        for (RoleCostRecord record : records) {
            if (record.covers(date)) match = record;
        }
        return Optional.ofNullable(match);
    }

    @JsonIgnore
    public Optional<RoleCostRecord> getOpenRecord() {
        return records.stream().filter(RoleCostRecord::isOpen).reduce((first, second) -> second);
    }

    /**
     * True when no two records overlap, every record ends on or after its start,
     * and at most one record (the last) is open.
     */
    @JsonIgnore
    public boolean isConsistent() {
        RoleCostRecord previous = null;
        for (RoleCostRecord record : records) {
            if (record.getStartDate() == null) return false;
            if (record.getEndDate() != null && record.getEndDate().isBefore(record.getStartDate())) return false;
            if (previous != null) {
                if (previous.isOpen()) return false;
                if (!previous.getEndDate().isBefore(record.getStartDate())) return false;
            }
            previous = record;
        }
        return true;
    }

    /**
     * Returns the history after a cost change taking effect on {@code effectiveFrom}:
     * the open record is closed the day before and a new open record starts on that day.
     * A record opened on the same day is replaced. This history is left untouched.
     *
     * @throws IllegalArgumentException when the change would start before the open record,
     *                                  which would rewrite past costs
     */
    public RoleCostHistory withCostChange(BigDecimal dailyCost, LocalDate effectiveFrom) {
        Objects.requireNonNull(dailyCost, "dailyCost");
        Objects.requireNonNull(effectiveFrom, "effectiveFrom");
        List<RoleCostRecord> revised = new ArrayList<>(records.size() + 1);
        for (RoleCostRecord record : records) {
            if (!record.isOpen()) {
                revised.add(record);
                continue;
            }
            if (record.getStartDate() != null && effectiveFrom.isBefore(record.getStartDate())) {
                throw new IllegalArgumentException("Cost change on " + effectiveFrom + " precedes the open record starting " + record.getStartDate());
            }
            if (effectiveFrom.equals(record.getStartDate())) continue;
            revised.add(record.toBuilder().endDate(effectiveFrom.minusDays(1)).build());
        }
        revised.add(RoleCostRecord.builder().dailyCost(dailyCost).startDate(effectiveFrom).build());
        return new RoleCostHistory(revised);
    }
}
