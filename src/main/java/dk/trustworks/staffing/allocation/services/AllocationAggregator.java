package dk.trustworks.staffing.allocation.services;

import dk.trustworks.staffing.allocation.model.AllocationAggregate;
import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.calendar.model.CompanyCalendar;
import dk.trustworks.staffing.calendar.services.CalendarService;
import dk.trustworks.staffing.costs.services.RoleCostResolver;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import static dk.trustworks.staffing.utils.NumberUtils.fraction;

/**
 * Reduces the sparse allocation of one assignment to person-days and cost.
 *
 * <p>Only allocation dates inside window ∩ employment ∩ project period that are
 * working days at the resource's location are counted. Allocations left behind after
 * a resignation are ignored without error.
 */
@JBossLog
@ApplicationScoped
public class AllocationAggregator {

    @Inject
    CalendarService calendarService;

    public AllocationAggregate aggregate(Assignment assignment, Resource resource, DateWindow window, CompanyCalendar calendar, RoleCostResolver costResolver) {
        return aggregate(assignment, resource, null, window, calendar, costResolver);
    }

    /**
     * @param project      may be {@code null}, then no project period and a realization of 100% apply
     * @param costResolver may be {@code null}, then cost stays zero
     */
    public AllocationAggregate aggregate(Assignment assignment, Resource resource, Project project, DateWindow window,
                                         CompanyCalendar calendar, RoleCostResolver costResolver) {
        if (assignment == null || resource == null) return AllocationAggregate.ZERO;
        if (window == null) throw new IllegalArgumentException("Aggregation window is required");
        if (assignment.getAllocation().isEmpty()) return AllocationAggregate.ZERO;

        DateWindow effective = effectiveWindow(resource, project, window);
        if (effective.isEmpty()) {
            log.debugf("Assignment %s has nothing to count in %s once clipped to employment and project period", assignment.getId(), window);
            return AllocationAggregate.ZERO;
        }

        BigDecimal realization = project == null || project.getRealizationPercentage() == null
                ? BigDecimal.ONE
                : fraction(project.getRealizationPercentage());

        BigDecimal personDays = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;
        for (Map.Entry<LocalDate, Integer> entry : assignment.getAllocation().entriesIn(effective).entrySet()) {
            LocalDate date = entry.getKey();
            if (!calendarService.isWorkingDay(date, resource.getLocation(), calendar)) continue;

            BigDecimal dayFraction = fraction(entry.getValue());
            personDays = personDays.add(dayFraction);
            if (costResolver != null) {
                cost = cost.add(dayFraction.multiply(costResolver.dailyCost(resource.getRoleId(), date)).multiply(realization));
            }
        }
        return new AllocationAggregate(personDays, cost);
    }

    /**
     * The requested window clipped to the resource's employment and the project period.
     */
    public DateWindow effectiveWindow(Resource resource, Project project, DateWindow window) {
        DateWindow effective = window.intersect(resource.effectiveWindow());
        if (project != null) effective = effective.intersect(project.window());
        return effective;
    }
}
