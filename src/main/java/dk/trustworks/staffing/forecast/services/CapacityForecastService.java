package dk.trustworks.staffing.forecast.services;

import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.calendar.services.CalendarService;
import dk.trustworks.staffing.config.StaffingEngineConfig;
import dk.trustworks.staffing.forecast.model.CapacityFilter;
import dk.trustworks.staffing.forecast.model.CapacityForecastMonth;
import dk.trustworks.staffing.forecast.model.MonthProjection;
import dk.trustworks.staffing.forecast.model.ProjectionState;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static dk.trustworks.staffing.utils.NumberUtils.fraction;
import static dk.trustworks.staffing.utils.NumberUtils.percentageOf;

/**
 * Month-by-month comparison of workforce capacity with planned and projected load.
 */
@JBossLog
@ApplicationScoped
public class CapacityForecastService {

    @Inject
    ForecastProjector projector;

    @Inject
    CalendarService calendarService;

    @Inject
    StaffingEngineConfig config;

    public List<CapacityForecastMonth> forecast(StaffingSnapshot snapshot, YearMonth firstMonth, int horizonMonths,
                                                CapacityFilter filter, LocalDate today) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        if (firstMonth == null) throw new IllegalArgumentException("First month is required");
        if (horizonMonths < 1) throw new IllegalArgumentException("Horizon must be at least one month, got " + horizonMonths);

        List<Resource> resources = selectResources(snapshot, filter == null ? CapacityFilter.none() : filter);
        log.debugf("Capacity forecast from %s for %d months over %d resources", firstMonth, horizonMonths, resources.size());

        List<CapacityForecastMonth> result = new ArrayList<>(horizonMonths);
        for (int i = 0; i < horizonMonths; i++) {
            result.add(forecastMonth(snapshot, resources, firstMonth.plusMonths(i), today));
        }
        return result;
    }

    private CapacityForecastMonth forecastMonth(StaffingSnapshot snapshot, List<Resource> resources, YearMonth month, LocalDate today) {
        int scale = config.getCalculationScale();
        BigDecimal available = BigDecimal.ZERO;
        BigDecimal allocated = BigDecimal.ZERO;
        BigDecimal projected = BigDecimal.ZERO;
        int activeResources = 0;

        for (Resource resource : resources) {
            DateWindow active = resource.effectiveWindow().intersect(DateWindow.ofMonth(month));
            if (!active.isEmpty()) {
                activeResources++;
                int workingDays = calendarService.workingDaysIn(active, snapshot.getCalendar(), resource.getLocation());
                available = available.add(BigDecimal.valueOf(workingDays).multiply(fraction(resource.getMaxStaffingPercentage())));
            }

            for (Assignment assignment : snapshot.assignmentsOfResource(resource.getId())) {
                Project project = snapshot.findProject(assignment.getProjectId()).orElse(null);
                if (project == null) continue;
                MonthProjection projection = projector.projectMonth(resource, assignment, project, month, snapshot.getCalendar(), today);
                allocated = allocated.add(projection.getPersonDays());
                if (projection.getState() == ProjectionState.PROJECTED) projected = projected.add(projection.getPersonDays());
            }
        }

        return CapacityForecastMonth.builder()
                .month(month)
                .resourceCount(activeResources)
                .availablePersonDays(available)
                .allocatedPersonDays(allocated)
                .projectedPersonDays(projected)
                .utilizationPercentage(percentageOf(allocated, available, scale))
                .surplusDeficit(available.subtract(allocated))
                .build();
    }

    private List<Resource> selectResources(StaffingSnapshot snapshot, CapacityFilter filter) {
        Set<String> staffedResourceIds = null;
        if (filter.getProjectId() != null) {
            staffedResourceIds = snapshot.assignmentsOfProject(filter.getProjectId()).stream()
                    .map(Assignment::getResourceId)
                    .collect(Collectors.toSet());
        } else if (filter.getClientId() != null) {
            staffedResourceIds = snapshot.getProjects().stream()
                    .filter(p -> filter.getClientId().equals(p.getClientId()))
                    .flatMap(p -> snapshot.assignmentsOfProject(p.getId()).stream())
                    .map(Assignment::getResourceId)
                    .collect(Collectors.toSet());
        }

        List<Resource> selected = new ArrayList<>();
        for (Resource resource : snapshot.getResources()) {
            if (filter.getHorizontal() != null && !Objects.equals(filter.getHorizontal(), resource.getHorizontal())) continue;
            if (staffedResourceIds != null && !staffedResourceIds.contains(resource.getId())) continue;
            selected.add(resource);
        }
        return selected;
    }
}
