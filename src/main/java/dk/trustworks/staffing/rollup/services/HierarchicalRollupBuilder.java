package dk.trustworks.staffing.rollup.services;

import dk.trustworks.staffing.allocation.model.AllocationAggregate;
import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.allocation.services.AllocationAggregator;
import dk.trustworks.staffing.config.StaffingEngineConfig;
import dk.trustworks.staffing.costs.services.RoleCostResolver;
import dk.trustworks.staffing.model.Project;
import dk.trustworks.staffing.model.Resource;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.rollup.model.RollupDimension;
import dk.trustworks.staffing.rollup.model.RollupKey;
import dk.trustworks.staffing.rollup.model.RollupNode;
import dk.trustworks.staffing.rollup.model.RollupUnit;
import dk.trustworks.staffing.utils.DateUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static dk.trustworks.staffing.utils.NumberUtils.safeDivide;

/**
 * Groups allocation values along a dimension path and by calendar month.
 *
 * <p>Examples of paths: {@code [CONTRACT, PROJECT, RESOURCE]} for the WBS view,
 * {@code [LOCATION]} for a site view, {@code [NONE]} for a flat table per resource.
 * Every assignment is aggregated once per month of the window, and values are
 * added up the path with exact decimal arithmetic, so a parent always equals the sum
 * of its children and a node's total equals the sum of its months.
 *
 * <p>Children come out in first-seen order. Callers sort with {@link RollupNode#sorted}.
 */
@JBossLog
@ApplicationScoped
public class HierarchicalRollupBuilder {

    public static final String ROOT_ID = "TOTAL";

    @Inject
    AllocationAggregator aggregator;

    @Inject
    DimensionResolver dimensionResolver;

    @Inject
    StaffingEngineConfig config;

    public RollupNode rollup(StaffingSnapshot snapshot, List<RollupDimension> dimensionPath, DateWindow window, RollupUnit unit) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        return rollup(snapshot, snapshot.getAssignments(), dimensionPath, window, snapshot.getCostResolver(), unit);
    }

    /**
     * Rolls up a chosen subset of assignments. Resources, projects, clients, contracts and
     * the calendar are looked up in the snapshot, cost comes from the given resolver.
     *
     * @param costResolver only consulted for {@link RollupUnit#COST}, {@code null} gives zero cost
     */
    public RollupNode rollup(StaffingSnapshot snapshot, Collection<Assignment> assignments, List<RollupDimension> dimensionPath,
                             DateWindow window, RoleCostResolver costResolver, RollupUnit unit) {
        if (snapshot == null) throw new IllegalArgumentException("Snapshot is required");
        if (window == null || !window.isBounded() || window.isEmpty()) {
            throw new IllegalArgumentException("Rollup needs a bounded, non-empty window, got " + window);
        }
        if (unit == null) throw new IllegalArgumentException("Rollup unit is required");

        List<RollupDimension> path = normalize(dimensionPath);
        List<YearMonth> months = window.months();
        RoleCostResolver resolver = unit == RollupUnit.COST ? costResolver : null;

        NodeAccumulator root = new NodeAccumulator(new RollupKey(ROOT_ID, "Total"), null, months);
        int included = 0;
        int skipped = 0;

        for (Assignment assignment : assignments == null ? List.<Assignment>of() : assignments) {
            if (assignment == null) continue;
            Optional<Resource> resource = snapshot.findResource(assignment.getResourceId());
            Optional<Project> project = snapshot.findProject(assignment.getProjectId());
            if (resource.isEmpty() || project.isEmpty()) {
                log.debugf("Skipping assignment %s, resource or project no longer exists", assignment.getId());
                skipped++;
                continue;
            }

            List<RollupKey> keys = resolvePath(path, assignment, resource.get(), project.get(), snapshot);
            if (keys == null) {
                log.debugf("Skipping assignment %s, a grouping entity no longer exists", assignment.getId());
                skipped++;
                continue;
            }

            Map<YearMonth, BigDecimal> monthly = new LinkedHashMap<>();
            boolean hasValue = false;
            for (YearMonth month : months) {
                DateWindow monthWindow = DateWindow.ofMonth(month).intersect(window);
                AllocationAggregate aggregate = aggregator.aggregate(assignment, resource.get(), project.get(), monthWindow, snapshot.getCalendar(), resolver);
                BigDecimal value = convert(aggregate, unit);
                monthly.put(month, value);
                if (value.signum() != 0) hasValue = true;
            }
            if (!hasValue) continue;

            NodeAccumulator node = root;
            node.add(monthly);
            for (int level = 0; level < path.size(); level++) {
                node = node.child(keys.get(level), path.get(level), months);
                node.add(monthly);
            }
            included++;
        }

        log.debugf("Rollup %s over %s in %s: %d assignments included, %d skipped", path, window, unit, included, skipped);
        return root.freeze();
    }

    private BigDecimal convert(AllocationAggregate aggregate, RollupUnit unit) {
        return switch (unit) {
            case DAYS -> aggregate.getPersonDays();
            case COST -> aggregate.getCost();
            case FTE -> safeDivide(aggregate.getPersonDays(), config.getReferenceWorkingDaysPerMonth(), config.getCalculationScale());
        };
    }

    private List<RollupKey> resolvePath(List<RollupDimension> path, Assignment assignment, Resource resource, Project project, StaffingSnapshot snapshot) {
        List<RollupKey> keys = new ArrayList<>(path.size());
        for (RollupDimension dimension : path) {
            Optional<RollupKey> key = dimensionResolver.resolve(dimension, assignment, resource, project, snapshot);
            if (key.isEmpty()) return null;
            keys.add(key.get());
        }
        return keys;
    }

    /**
     * {@code NONE} only means something on its own, as the flat resource table.
     */
    static List<RollupDimension> normalize(List<RollupDimension> dimensionPath) {
        if (dimensionPath == null || dimensionPath.isEmpty()) return List.of(RollupDimension.RESOURCE);
        List<RollupDimension> path = dimensionPath.stream().filter(d -> d != null && d != RollupDimension.NONE).toList();
        return path.isEmpty() ? List.of(RollupDimension.RESOURCE) : path;
    }

    private static final class NodeAccumulator {

        private final RollupKey key;
        private final RollupDimension dimension;
        private final TreeMap<String, BigDecimal> monthlyValues = new TreeMap<>();
        private final Map<String, NodeAccumulator> children = new LinkedHashMap<>();

        private NodeAccumulator(RollupKey key, RollupDimension dimension, List<YearMonth> months) {
            this.key = key;
            this.dimension = dimension;
            for (YearMonth month : months) monthlyValues.put(DateUtils.monthKey(month), BigDecimal.ZERO);
        }

        private NodeAccumulator child(RollupKey childKey, RollupDimension childDimension, List<YearMonth> months) {
            return children.computeIfAbsent(childKey.getId(), id -> new NodeAccumulator(childKey, childDimension, months));
        }

        private void add(Map<YearMonth, BigDecimal> monthly) {
            monthly.forEach((month, value) -> monthlyValues.merge(DateUtils.monthKey(month), value, BigDecimal::add));
        }

        private RollupNode freeze() {
            BigDecimal total = monthlyValues.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            List<RollupNode> frozenChildren = children.values().stream().map(NodeAccumulator::freeze).toList();
            return new RollupNode(key.getId(), key.getLabel(), dimension, total, monthlyValues, frozenChildren);
        }
    }
}
