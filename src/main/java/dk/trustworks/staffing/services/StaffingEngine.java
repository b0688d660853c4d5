package dk.trustworks.staffing.services;

import dk.trustworks.staffing.allocation.model.Allocation;
import dk.trustworks.staffing.allocation.model.AllocationAggregate;
import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.allocation.services.AllocationAggregator;
import dk.trustworks.staffing.calendar.services.CalendarService;
import dk.trustworks.staffing.exceptions.StaffingEngineException;
import dk.trustworks.staffing.forecast.model.CapacityFilter;
import dk.trustworks.staffing.forecast.model.CapacityForecastMonth;
import dk.trustworks.staffing.forecast.model.MonthProjection;
import dk.trustworks.staffing.forecast.services.CapacityForecastService;
import dk.trustworks.staffing.forecast.services.ForecastProjector;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.reports.model.DailyLoad;
import dk.trustworks.staffing.reports.model.MarginFilter;
import dk.trustworks.staffing.reports.model.MonthlyMargin;
import dk.trustworks.staffing.reports.model.OverAllocation;
import dk.trustworks.staffing.reports.model.ProjectBudgetAnalysis;
import dk.trustworks.staffing.reports.model.ProjectMargin;
import dk.trustworks.staffing.reports.model.UtilizationFilter;
import dk.trustworks.staffing.reports.model.UtilizationRow;
import dk.trustworks.staffing.reports.services.BudgetAnalysisService;
import dk.trustworks.staffing.reports.services.DailyLoadService;
import dk.trustworks.staffing.reports.services.MarginAnalysisService;
import dk.trustworks.staffing.reports.services.ResourceUtilizationService;
import dk.trustworks.staffing.rollup.model.RollupDimension;
import dk.trustworks.staffing.rollup.model.RollupNode;
import dk.trustworks.staffing.rollup.model.RollupUnit;
import dk.trustworks.staffing.rollup.services.HierarchicalRollupBuilder;
import io.quarkus.cache.CacheInvalidateAll;
import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for everything that plans or costs staffing.
 *
 * <p>Callers hand in a {@link StaffingSnapshot} and get results back synchronously.
 * Rollups are cached on the snapshot version and a fingerprint of its content, so a
 * changed input never returns a stale tree. Forecasts depend on the current date and are
 * never cached.
 */
@JBossLog
@ApplicationScoped
public class StaffingEngine {

    public static final String ROLLUP_CACHE = "staffing-rollup";

    @Inject
    AllocationAggregator aggregator;

    @Inject
    HierarchicalRollupBuilder rollupBuilder;

    @Inject
    ForecastProjector forecastProjector;

    @Inject
    CapacityForecastService capacityForecastService;

    @Inject
    ResourceUtilizationService utilizationService;

    @Inject
    BudgetAnalysisService budgetAnalysisService;

    @Inject
    DailyLoadService dailyLoadService;

    @Inject
    MarginAnalysisService marginAnalysisService;

    @Inject
    CalendarService calendarService;

    @Inject
    Clock clock;

    /**
     * Person-days and, when {@code withCost} is set, cost of one assignment in the window.
     * An assignment whose resource is no longer in the snapshot counts as zero.
     */
    public AllocationAggregate aggregate(StaffingSnapshot snapshot, Assignment assignment, DateWindow window, boolean withCost) {
        if (assignment == null) return AllocationAggregate.ZERO;
        Resource resource = snapshot.findResource(assignment.getResourceId()).orElse(null);
        if (resource == null) {
            log.debugf("Assignment %s refers to unknown resource %s", assignment.getId(), assignment.getResourceId());
            return AllocationAggregate.ZERO;
        }
        Project project = snapshot.findProject(assignment.getProjectId()).orElse(null);
        if (project == null) {
            log.debugf("Assignment %s refers to unknown project %s", assignment.getId(), assignment.getProjectId());
            return AllocationAggregate.ZERO;
        }
        return aggregator.aggregate(assignment, resource, project, window, snapshot.getCalendar(), withCost ? snapshot.getCostResolver() : null);
    }

    /**
     * Cached on (snapshot version, snapshot fingerprint, dimension path, window, unit).
     */
    @CacheResult(cacheName = ROLLUP_CACHE, keyGenerator = RollupCacheKeyGenerator.class)
    public RollupNode rollup(StaffingSnapshot snapshot, List<RollupDimension> dimensionPath, DateWindow window, RollupUnit unit) {
        log.debugf("Building rollup %s over %s in %s for snapshot version %d", dimensionPath, window, unit, snapshot.getVersion());
        return rollupBuilder.rollup(snapshot, dimensionPath, window, unit);
    }

    @CacheInvalidateAll(cacheName = ROLLUP_CACHE)
    public void invalidateCaches() {
        log.info("Staffing rollup cache invalidated");
    }

    /**
     * Load of one assignment in a month, measured against the injected clock.
     */
    public MonthProjection projectMonth(StaffingSnapshot snapshot, String assignmentId, YearMonth month) {
        Assignment assignment = snapshot.findAssignment(assignmentId).orElse(null);
        if (assignment == null) {
            log.debugf("No projection for unknown assignment %s", assignmentId);
            return MonthProjection.none(month);
        }
        Resource resource = snapshot.findResource(assignment.getResourceId()).orElse(null);
        Project project = snapshot.findProject(assignment.getProjectId()).orElse(null);
        if (resource == null || project == null) return MonthProjection.none(month);
        return forecastProjector.projectMonth(resource, assignment, project, month, snapshot.getCalendar(), today());
    }

    public List<MonthProjection> projectMonths(StaffingSnapshot snapshot, String assignmentId, YearMonth firstMonth, int months) {
        List<MonthProjection> projections = new ArrayList<>(months);
        for (int i = 0; i < months; i++) {
            projections.add(projectMonth(snapshot, assignmentId, firstMonth.plusMonths(i)));
        }
        return projections;
    }

    public BigDecimal dailyCost(StaffingSnapshot snapshot, String roleId, LocalDate date) {
        return snapshot.getCostResolver().dailyCost(roleId, date);
    }

    public List<CapacityForecastMonth> capacityForecast(StaffingSnapshot snapshot, YearMonth firstMonth, int horizonMonths, CapacityFilter filter) {
        return capacityForecastService.forecast(snapshot, firstMonth, horizonMonths, filter, today());
    }

    public List<UtilizationRow> utilization(StaffingSnapshot snapshot, YearMonth month, UtilizationFilter filter) {
        return utilizationService.monthlyReport(snapshot, month, filter);
    }

    public List<ProjectBudgetAnalysis> budgetAnalysis(StaffingSnapshot snapshot, DateWindow window, String clientId) {
        return budgetAnalysisService.analyse(snapshot, window, clientId);
    }

    public List<MonthlyMargin> monthlyMargins(StaffingSnapshot snapshot, DateWindow window, MarginFilter filter) {
        return marginAnalysisService.monthly(snapshot, window, filter);
    }

    public List<ProjectMargin> projectMargins(StaffingSnapshot snapshot, DateWindow window, MarginFilter filter) {
        return marginAnalysisService.byProject(snapshot, window, filter);
    }

    public List<DailyLoad> dailyLoad(StaffingSnapshot snapshot, String resourceId, DateWindow window) {
        return dailyLoadService.dailyLoad(snapshot, resourceId, window);
    }

    public List<OverAllocation> overAllocations(StaffingSnapshot snapshot, DateWindow window) {
        return dailyLoadService.overAllocations(snapshot, window);
    }

    /**
     * Sets {@code percentage} on every working day of the range for the assignment's
     * resource and returns the updated assignment. The snapshot is not changed.
     */
    public Assignment planRange(StaffingSnapshot snapshot, String assignmentId, LocalDate from, LocalDate to, int percentage) {
        Assignment assignment = snapshot.findAssignment(assignmentId)
                .orElseThrow(() -> new StaffingEngineException("Unknown assignment " + assignmentId));
        String location = snapshot.findResource(assignment.getResourceId()).map(Resource::getLocation).orElse(null);
        List<LocalDate> dates = calendarService.workingDates(from, to, snapshot.getCalendar(), location);
        Allocation updated = assignment.getAllocation().withPercentage(dates, percentage);
        log.debugf("Planned %d%% on %d working days for assignment %s", percentage, dates.size(), assignmentId);
        return assignment.toBuilder().allocation(updated).build();
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
