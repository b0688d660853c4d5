package dk.trustworks.staffing.reports.services;

import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.allocation.services.AllocationAggregator;
import dk.trustworks.staffing.calendar.services.CalendarService;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.reports.model.DailyLoad;
import dk.trustworks.staffing.reports.model.OverAllocation;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Day-by-day load of a resource across all of its assignments.
 *
 * <p>Only working days inside the resource's employment and each project's period are
 * counted, the same dates the aggregator counts. Going over the staffing cap is reported,
 * never rejected.
 */
@JBossLog
@ApplicationScoped
public class DailyLoadService {

    @Inject
    AllocationAggregator aggregator;

    @Inject
    CalendarService calendarService;

    /**
     * @return one entry per working day with a non-empty allocation, date ordered;
     *         empty when the resource is unknown
     */
    public List<DailyLoad> dailyLoad(StaffingSnapshot snapshot, String resourceId, DateWindow window) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        if (window == null) throw new IllegalArgumentException("Window is required");
        return snapshot.findResource(resourceId)
                .map(resource -> dailyLoad(snapshot, resource, window))
                .orElseGet(List::of);
    }

    public List<OverAllocation> overAllocations(StaffingSnapshot snapshot, DateWindow window) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        if (window == null) throw new IllegalArgumentException("Window is required");

        List<OverAllocation> result = new ArrayList<>();
        for (Resource resource : snapshot.getResources()) {
            List<DailyLoad> overloaded = dailyLoad(snapshot, resource, window).stream()
                    .filter(DailyLoad::isOverAllocated)
                    .toList();
            if (overloaded.isEmpty()) continue;
            log.debugf("Resource %s is over-allocated on %d days in %s", resource.getId(), overloaded.size(), window);
            result.add(new OverAllocation(resource.getId(), resource.getName(), resource.getMaxStaffingPercentage(), overloaded));
        }
        return result;
    }

    private List<DailyLoad> dailyLoad(StaffingSnapshot snapshot, Resource resource, DateWindow window) {
        Map<LocalDate, Map<String, Integer>> byDate = new TreeMap<>();
        for (Assignment assignment : snapshot.assignmentsOfResource(resource.getId())) {
            Project project = snapshot.findProject(assignment.getProjectId()).orElse(null);
            if (project == null) continue;
            DateWindow effective = aggregator.effectiveWindow(resource, project, window);
            if (effective.isEmpty()) continue;

            assignment.getAllocation().entriesIn(effective).forEach((date, percentage) -> {
                if (!calendarService.isWorkingDay(date, resource.getLocation(), snapshot.getCalendar())) return;
                byDate.computeIfAbsent(date, d -> new LinkedHashMap<>()).merge(project.getId(), percentage, Integer::sum);
            });
        }

        List<DailyLoad> loads = new ArrayList<>(byDate.size());
        byDate.forEach((date, breakdown) -> {
            int total = breakdown.values().stream().mapToInt(Integer::intValue).sum();
            loads.add(new DailyLoad(resource.getId(), date, total, resource.getMaxStaffingPercentage(), breakdown));
        });
        return loads;
    }
}
