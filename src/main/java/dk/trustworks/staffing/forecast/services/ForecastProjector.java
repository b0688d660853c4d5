package dk.trustworks.staffing.forecast.services;

import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.allocation.services.AllocationAggregator;
import dk.trustworks.staffing.calendar.model.CompanyCalendar;
import dk.trustworks.staffing.calendar.services.CalendarService;
import dk.trustworks.staffing.config.StaffingEngineConfig;
import dk.trustworks.staffing.forecast.model.MonthProjection;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;

/**
 * Estimates the load of one assignment in a month.
 *
 * <p>Planned data always wins: a month up to the current one, or any month that already
 * has allocation entries, is reported as the exact aggregate. Only a future month with no
 * entries at all is extrapolated, using the average person-days per working day of the
 * most recent months that do have entries. Nothing is stored, every call derives the
 * projection from the allocations as they are now.
 */
@JBossLog
@ApplicationScoped
public class ForecastProjector {

    @Inject
    AllocationAggregator aggregator;

    @Inject
    CalendarService calendarService;

    @Inject
    StaffingEngineConfig config;

    /**
     * @param project may be {@code null}, then no project period applies
     * @param today   decides which months are past; callers pass the injected clock's date
     */
    public MonthProjection projectMonth(Resource resource, Assignment assignment, Project project, YearMonth month,
                                        CompanyCalendar calendar, LocalDate today) {
        if (month == null) throw new IllegalArgumentException("Month is required");
        if (today == null) throw new IllegalArgumentException("Today is required");
        if (resource == null || assignment == null) return MonthProjection.none(month);

        YearMonth currentMonth = YearMonth.from(today);
        if (!month.isAfter(currentMonth) || assignment.getAllocation().hasEntriesIn(month)) {
            return MonthProjection.actual(month, personDaysIn(assignment, resource, project, month, calendar));
        }

        DateWindow activeWindow = aggregator.effectiveWindow(resource, project, DateWindow.ofMonth(month));
        if (activeWindow.isEmpty()) {
            log.debugf("No projection for assignment %s in %s, resource or project not active", assignment.getId(), month);
            return MonthProjection.none(month);
        }

        Optional<BigDecimal> runRate = runRate(resource, assignment, project, month, calendar);
        if (runRate.isEmpty()) {
            log.debugf("No projection for assignment %s in %s, no recent allocations to extrapolate", assignment.getId(), month);
            return MonthProjection.none(month);
        }

        int workingDays = calendarService.workingDaysIn(activeWindow, calendar, resource.getLocation());
        BigDecimal projected = runRate.get().multiply(BigDecimal.valueOf(workingDays)).setScale(config.getCalculationScale(), RoundingMode.HALF_UP);
        return MonthProjection.projected(month, projected, runRate.get());
    }

    /**
     * Average of person-days per working day over the last months before {@code target}
     * that have allocation entries. Months without working days in the active period are
     * passed over so they never dilute the average.
     */
    Optional<BigDecimal> runRate(Resource resource, Assignment assignment, Project project, YearMonth target, CompanyCalendar calendar) {
        int lookback = config.getForecastLookbackMonths();
        int scale = config.getCalculationScale();
        BigDecimal sum = BigDecimal.ZERO;
        int samples = 0;

        YearMonth month = target.minusMonths(1);
        for (int scanned = 0; scanned < config.getForecastMaxScanMonths() && samples < lookback; scanned++, month = month.minusMonths(1)) {
            if (!assignment.getAllocation().hasEntriesIn(month)) continue;
            DateWindow active = aggregator.effectiveWindow(resource, project, DateWindow.ofMonth(month));
            if (active.isEmpty()) continue;
            int workingDays = calendarService.workingDaysIn(active, calendar, resource.getLocation());
            if (workingDays == 0) continue;

            BigDecimal personDays = personDaysIn(assignment, resource, project, month, calendar);
            sum = sum.add(personDays.divide(BigDecimal.valueOf(workingDays), scale, RoundingMode.HALF_UP));
            samples++;
        }

        if (samples == 0) return Optional.empty();
        return Optional.of(sum.divide(BigDecimal.valueOf(samples), scale, RoundingMode.HALF_UP));
    }

    private BigDecimal personDaysIn(Assignment assignment, Resource resource, Project project, YearMonth month, CompanyCalendar calendar) {
        return aggregator.aggregate(assignment, resource, project, DateWindow.ofMonth(month), calendar, null).getPersonDays();
    }
}
