package dk.trustworks.staffing.reports.services;

import dk.trustworks.staffing.allocation.model.AllocationAggregate;
import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.allocation.services.AllocationAggregator;
import dk.trustworks.staffing.config.StaffingEngineConfig;
import dk.trustworks.staffing.model.BillingMilestone;
import dk.trustworks.staffing.model.BillingType;
import dk.trustworks.staffing.model.Contract;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.reports.model.MarginFilter;
import dk.trustworks.staffing.reports.model.MonthlyMargin;
import dk.trustworks.staffing.reports.model.ProjectMargin;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dk.trustworks.staffing.utils.NumberUtils.percentageOf;

/**
 * Revenue, cost and margin of the portfolio.
 *
 * <p>Time and material projects earn the allocated days at the sell rate of each resource
 * on the contract's rate card. Fixed-price projects earn their billing milestones in the
 * month of the milestone date. Cost is the labour cost at historic role costs adjusted
 * by realization, counted on the same days as the revenue.
 */
@JBossLog
@ApplicationScoped
public class MarginAnalysisService {

    @Inject
    AllocationAggregator aggregator;

    @Inject
    StaffingEngineConfig config;

    /**
     * One row per month of the window, months without activity included.
     */
    public List<MonthlyMargin> monthly(StaffingSnapshot snapshot, DateWindow window, MarginFilter filter) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        if (window == null || !window.isBounded() || window.isEmpty()) {
            throw new IllegalArgumentException("Monthly margins need a bounded, non-empty window, got " + window);
        }
        MarginFilter effectiveFilter = filter == null ? MarginFilter.none() : filter;

        Map<YearMonth, Amounts> totals = new LinkedHashMap<>();
        for (YearMonth month : window.months()) totals.put(month, Amounts.ZERO);

        for (Project project : snapshot.getProjects()) {
            if (!matches(snapshot, project, effectiveFilter)) continue;
            for (YearMonth month : window.months()) {
                DateWindow monthWindow = DateWindow.ofMonth(month).intersect(window);
                totals.merge(month, projectAmounts(snapshot, project, monthWindow), Amounts::plus);
            }
        }

        List<MonthlyMargin> result = new ArrayList<>(totals.size());
        totals.forEach((month, amounts) -> {
            result.add(MonthlyMargin.builder()
                    .month(month)
                    .revenue(amounts.revenue())
                    .cost(amounts.cost())
                    .margin(amounts.margin())
                    .marginPercentage(percentageOf(amounts.margin(), amounts.revenue(), config.getCalculationScale()))
                    .build());
        });
        return result;
    }

    /**
     * @param window {@code null} means the whole life of each project
     */
    public List<ProjectMargin> byProject(StaffingSnapshot snapshot, DateWindow window, MarginFilter filter) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        DateWindow effectiveWindow = window == null ? DateWindow.unbounded() : window;
        MarginFilter effectiveFilter = filter == null ? MarginFilter.none() : filter;

        List<ProjectMargin> result = new ArrayList<>();
        for (Project project : snapshot.getProjects()) {
            if (!matches(snapshot, project, effectiveFilter)) continue;
            Amounts amounts = projectAmounts(snapshot, project, effectiveWindow);
            result.add(ProjectMargin.builder()
                    .projectId(project.getId())
                    .projectName(project.getName())
                    .clientId(project.getClientId())
                    .billingType(snapshot.billingTypeOf(project))
                    .budget(project.getBudget() == null ? BigDecimal.ZERO : project.getBudget())
                    .personDays(amounts.personDays())
                    .revenue(amounts.revenue())
                    .cost(amounts.cost())
                    .margin(amounts.margin())
                    .marginPercentage(percentageOf(amounts.margin(), amounts.revenue(), config.getCalculationScale()))
                    .build());
        }
        return result;
    }

    private Amounts projectAmounts(StaffingSnapshot snapshot, Project project, DateWindow window) {
        BillingType billingType = snapshot.billingTypeOf(project);
        BigDecimal personDays = BigDecimal.ZERO;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal cost = BigDecimal.ZERO;

        for (Assignment assignment : snapshot.assignmentsOfProject(project.getId())) {
            Resource resource = snapshot.findResource(assignment.getResourceId()).orElse(null);
            if (resource == null) {
                log.debugf("Assignment %s on project %s has no resource, left out of the margin", assignment.getId(), project.getId());
                continue;
            }
            AllocationAggregate aggregate = aggregator.aggregate(assignment, resource, project, window, snapshot.getCalendar(), snapshot.getCostResolver());
            personDays = personDays.add(aggregate.getPersonDays());
            cost = cost.add(aggregate.getCost());
            if (billingType == BillingType.TIME_MATERIAL) {
                revenue = revenue.add(aggregate.getPersonDays().multiply(snapshot.sellRate(project, resource.getId())));
            }
        }

        if (billingType == BillingType.FIXED_PRICE) {
            for (BillingMilestone milestone : snapshot.milestonesOfProject(project.getId())) {
                if (milestone.getDate() == null || milestone.getAmount() == null || !window.contains(milestone.getDate())) continue;
                revenue = revenue.add(milestone.getAmount());
            }
        }
        return new Amounts(personDays, revenue, cost);
    }

    private boolean matches(StaffingSnapshot snapshot, Project project, MarginFilter filter) {
        if (filter.getProjectId() != null && !filter.getProjectId().equals(project.getId())) return false;
        if (filter.getClientId() != null && !filter.getClientId().equals(project.getClientId())) return false;
        if (filter.getWbsCode() != null) {
            String wbsCode = snapshot.findContract(project.getContractId()).map(Contract::getWbsCode).orElse(null);
            return filter.getWbsCode().equals(wbsCode);
        }
        return true;
    }

    private record Amounts(BigDecimal personDays, BigDecimal revenue, BigDecimal cost) {

        static final Amounts ZERO = new Amounts(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

        Amounts plus(Amounts other) {
            return new Amounts(personDays.add(other.personDays), revenue.add(other.revenue), cost.add(other.cost));
        }

        BigDecimal margin() {
            return revenue.subtract(cost);
        }
    }
}
