package dk.trustworks.staffing.reports.services;

import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.allocation.services.AllocationAggregator;
import dk.trustworks.staffing.config.StaffingEngineConfig;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.reports.model.ProjectBudgetAnalysis;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static dk.trustworks.staffing.utils.NumberUtils.percentageOf;

/**
 * Estimated cost per project, at historic role costs and adjusted by the project's
 * realization, compared with its budget.
 */
@JBossLog
@ApplicationScoped
public class BudgetAnalysisService {

    @Inject
    AllocationAggregator aggregator;

    @Inject
    StaffingEngineConfig config;

    public List<ProjectBudgetAnalysis> analyse(StaffingSnapshot snapshot, DateWindow window) {
        return analyse(snapshot, window, null);
    }

    /**
     * @param window   {@code null} means the whole life of each project
     * @param clientId optional, restricts the analysis to the projects of one client
     */
    public List<ProjectBudgetAnalysis> analyse(StaffingSnapshot snapshot, DateWindow window, String clientId) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        DateWindow effectiveWindow = window == null ? DateWindow.unbounded() : window;

        List<ProjectBudgetAnalysis> result = new ArrayList<>();
        for (Project project : snapshot.getProjects()) {
            if (clientId != null && !clientId.equals(project.getClientId())) continue;
            result.add(analyseProject(snapshot, project, effectiveWindow));
        }
        return result;
    }

    private ProjectBudgetAnalysis analyseProject(StaffingSnapshot snapshot, Project project, DateWindow window) {
        BigDecimal cost = BigDecimal.ZERO;
        for (Assignment assignment : snapshot.assignmentsOfProject(project.getId())) {
            Resource resource = snapshot.findResource(assignment.getResourceId()).orElse(null);
            if (resource == null) {
                log.debugf("Assignment %s on project %s has no resource, left out of the budget", assignment.getId(), project.getId());
                continue;
            }
            cost = cost.add(aggregator.aggregate(assignment, resource, project, window, snapshot.getCalendar(), snapshot.getCostResolver()).getCost());
        }

        BigDecimal budget = project.getBudget() == null ? BigDecimal.ZERO : project.getBudget();
        return ProjectBudgetAnalysis.builder()
                .projectId(project.getId())
                .projectName(project.getName())
                .clientId(project.getClientId())
                .budget(budget)
                .estimatedCost(cost)
                .variance(budget.subtract(cost))
                .consumptionPercentage(percentageOf(cost, budget, config.getCalculationScale()))
                .build();
    }
}
