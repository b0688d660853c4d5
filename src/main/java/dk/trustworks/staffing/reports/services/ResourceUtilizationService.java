package dk.trustworks.staffing.reports.services;

import dk.trustworks.staffing.allocation.model.AllocationAggregate;
import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.allocation.services.AllocationAggregator;
import dk.trustworks.staffing.calendar.services.CalendarService;
import dk.trustworks.staffing.config.StaffingEngineConfig;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.reports.model.UtilizationFilter;
import dk.trustworks.staffing.reports.model.UtilizationRow;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static dk.trustworks.staffing.utils.NumberUtils.fraction;
import static dk.trustworks.staffing.utils.NumberUtils.percentageOf;

/**
 * Monthly utilization per resource: planned person-days against the days the resource
 * could be staffed. Resigned resources are left out of the report.
 */
@JBossLog
@ApplicationScoped
public class ResourceUtilizationService {

    @Inject
    AllocationAggregator aggregator;

    @Inject
    CalendarService calendarService;

    @Inject
    StaffingEngineConfig config;

    public List<UtilizationRow> monthlyReport(StaffingSnapshot snapshot, YearMonth month, UtilizationFilter filter) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        if (month == null) throw new IllegalArgumentException("Month is required");
        UtilizationFilter effectiveFilter = filter == null ? UtilizationFilter.none() : filter;

        DateWindow monthWindow = DateWindow.ofMonth(month);
        List<UtilizationRow> rows = new ArrayList<>();
        for (Resource resource : snapshot.getResources()) {
            if (resource.isResigned() || !matches(resource, effectiveFilter)) continue;
            DateWindow active = resource.effectiveWindow().intersect(monthWindow);
            if (active.isEmpty()) continue;
            rows.add(row(snapshot, resource, month, active));
        }
        log.debugf("Utilization report for %s: %d resources", month, rows.size());
        return rows;
    }

    private UtilizationRow row(StaffingSnapshot snapshot, Resource resource, YearMonth month, DateWindow active) {
        int workingDays = calendarService.workingDaysIn(active, snapshot.getCalendar(), resource.getLocation());
        BigDecimal available = BigDecimal.valueOf(workingDays).multiply(fraction(resource.getMaxStaffingPercentage()));

        AllocationAggregate allocated = AllocationAggregate.ZERO;
        for (Assignment assignment : snapshot.assignmentsOfResource(resource.getId())) {
            Project project = snapshot.findProject(assignment.getProjectId()).orElse(null);
            if (project == null) continue;
            allocated = allocated.plus(aggregator.aggregate(assignment, resource, project, DateWindow.ofMonth(month),
                    snapshot.getCalendar(), snapshot.getCostResolver()));
        }

        return UtilizationRow.builder()
                .resourceId(resource.getId())
                .resourceName(resource.getName())
                .roleId(resource.getRoleId())
                .horizontal(resource.getHorizontal())
                .month(month)
                .workingDays(workingDays)
                .availableDays(available)
                .allocatedDays(allocated.getPersonDays())
                .allocatedCost(allocated.getCost())
                .utilizationPercentage(percentageOf(allocated.getPersonDays(), available, config.getCalculationScale()))
                .build();
    }

    private static boolean matches(Resource resource, UtilizationFilter filter) {
        if (filter.getRoleId() != null && !Objects.equals(filter.getRoleId(), resource.getRoleId())) return false;
        return filter.getHorizontal() == null || Objects.equals(filter.getHorizontal(), resource.getHorizontal());
    }
}
