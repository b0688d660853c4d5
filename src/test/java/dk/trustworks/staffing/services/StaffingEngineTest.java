package dk.trustworks.staffing.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.trustworks.staffing.allocation.model.AllocationAggregate;
import dk.trustworks.staffing.allocation.model.Assignment;
import dk.trustworks.staffing.allocation.model.DateWindow;
import dk.trustworks.staffing.exceptions.MalformedAllocationException;
import dk.trustworks.staffing.forecast.model.CapacityFilter;
import dk.trustworks.staffing.forecast.model.MonthProjection;
import dk.trustworks.staffing.forecast.model.ProjectionState;
import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.reports.model.MarginFilter;
import dk.trustworks.staffing.reports.model.OverAllocation;
import dk.trustworks.staffing.reports.model.ProjectBudgetAnalysis;
import dk.trustworks.staffing.reports.model.ProjectMargin;
import dk.trustworks.staffing.reports.model.UtilizationFilter;
import dk.trustworks.staffing.reports.model.UtilizationRow;
import dk.trustworks.staffing.rollup.model.RollupDimension;
import dk.trustworks.staffing.rollup.model.RollupNode;
import dk.trustworks.staffing.rollup.model.RollupUnit;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.YearMonth;
import java.util.List;

import static dk.trustworks.staffing.utils.AssertionHelpers.assertAmount;
import static dk.trustworks.staffing.utils.TestDataBuilders.assignment;
import static dk.trustworks.staffing.utils.TestDataBuilders.date;
import static dk.trustworks.staffing.utils.TestDataBuilders.project;
import static dk.trustworks.staffing.utils.TestDataBuilders.resource;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests through the engine facade, with the snapshot read from JSON
 * and the clock fixed on 2024-06-15 by the test profile.
 */
@QuarkusTest
@DisplayName("StaffingEngine")
class StaffingEngineTest {

    private static final DateWindow MAY_JUNE = DateWindow.of(date("2024-05-01"), date("2024-06-30"));

    @Inject
    StaffingEngine engine;

    @Inject
    ObjectMapper objectMapper;

    private StaffingSnapshot snapshot;

    @BeforeEach
    void loadSnapshot() throws IOException {
        snapshot = read("/fixtures/staffing-snapshot.json");
    }

    private StaffingSnapshot read(String resource) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            return objectMapper.readValue(in, StaffingSnapshot.class);
        }
    }

    @Nested
    @DisplayName("snapshot binding")
    class Binding {

        @Test
        @DisplayName("JSON snapshot is indexed on load")
        void indexed() {
            assertEquals(42, snapshot.getVersion());
            assertEquals(2, snapshot.getResources().size());
            assertEquals("Giulia Rossi", snapshot.findResource("r-milan").orElseThrow().getName());
            assertEquals(1, snapshot.assignmentsOfProject("p-data").size());
            assertEquals(2, snapshot.getCalendar().getEvents().size());
        }

        @Test
        @DisplayName("a malformed allocation key fails the whole load")
        void malformedKey() {
            Exception e = assertThrows(Exception.class, () -> read("/fixtures/malformed-allocation.json"));

            Throwable cause = e;
            while (cause != null && !(cause instanceof MalformedAllocationException)) cause = cause.getCause();
            assertNotNull(cause, "expected a MalformedAllocationException in " + e);
            assertEquals("30/05/2024", ((MalformedAllocationException) cause).getOffendingKey());
        }
    }

    @Test
    @DisplayName("Milan scenario through the facade")
    void milanScenario() {
        Assignment assignment = snapshot.findAssignment("a-portal").orElseThrow();

        AllocationAggregate withCost = engine.aggregate(snapshot, assignment, MAY_JUNE, true);
        AllocationAggregate withoutCost = engine.aggregate(snapshot, assignment, MAY_JUNE, false);

        assertAmount("1.0", withCost.getPersonDays());
        assertAmount("100.0", withCost.getCost());
        assertAmount("0", withoutCost.getCost());
    }

    @Test
    @DisplayName("daily cost follows the role history")
    void dailyCost() {
        assertAmount("100", engine.dailyCost(snapshot, "consultant", date("2024-05-31")));
        assertAmount("120", engine.dailyCost(snapshot, "consultant", date("2024-06-01")));
        assertAmount("0", engine.dailyCost(snapshot, "consultant", date("2022-12-31")));
    }

    @Nested
    @DisplayName("forecast")
    class Forecast {

        @Test
        @DisplayName("today comes from the configured clock")
        void fixedClock() {
            assertEquals(date("2024-06-15"), engine.today());
        }

        @Test
        @DisplayName("future month without allocations is projected from May")
        void projected() {
            MonthProjection august = engine.projectMonth(snapshot, "a-data", YearMonth.of(2024, 8));

            assertEquals(ProjectionState.PROJECTED, august.getState());
            // 5 of 23 days in May, 21 working days in August after Ferragosto
            assertAmount("0.217391", august.getRunRate());
            assertAmount("4.565211", august.getPersonDays());
        }

        @Test
        @DisplayName("past and current months are actual")
        void actual() {
            List<MonthProjection> months = engine.projectMonths(snapshot, "a-data", YearMonth.of(2024, 5), 3);

            assertEquals(ProjectionState.ACTUAL, months.get(0).getState());
            assertAmount("5", months.get(0).getPersonDays());
            assertEquals(ProjectionState.ACTUAL, months.get(1).getState());
            assertEquals(ProjectionState.PROJECTED, months.get(2).getState());
        }

        @Test
        @DisplayName("month after the project ends has no projection")
        void afterProjectEnd() {
            assertEquals(ProjectionState.NONE, engine.projectMonth(snapshot, "a-data", YearMonth.of(2025, 1)).getState());
        }

        @Test
        @DisplayName("unknown assignment has no projection")
        void unknownAssignment() {
            assertEquals(ProjectionState.NONE, engine.projectMonth(snapshot, "missing", YearMonth.of(2024, 8)).getState());
        }

        @Test
        @DisplayName("capacity forecast uses the configured clock")
        void capacity() {
            assertEquals(3, engine.capacityForecast(snapshot, YearMonth.of(2024, 6), 3, CapacityFilter.none()).size());
        }
    }

    @Nested
    @DisplayName("rollup cache")
    class RollupCache {

        @Test
        @DisplayName("same version, path, window and unit is served from the cache")
        void cached() {
            RollupNode first = engine.rollup(snapshot, List.of(RollupDimension.CLIENT), MAY_JUNE, RollupUnit.DAYS);
            RollupNode second = engine.rollup(snapshot, List.of(RollupDimension.CLIENT), MAY_JUNE, RollupUnit.DAYS);

            assertSame(first, second);
            assertAmount("6", first.getTotalValue());
        }

        @Test
        @DisplayName("a new snapshot version is a new entry")
        void newVersion() {
            RollupNode first = engine.rollup(snapshot, List.of(RollupDimension.PROJECT), MAY_JUNE, RollupUnit.COST);
            StaffingSnapshot changed = StaffingSnapshot.builder()
                    .version(snapshot.getVersion() + 1)
                    .resources(snapshot.getResources())
                    .roles(snapshot.getRoles())
                    .projects(snapshot.getProjects())
                    .clients(snapshot.getClients())
                    .contracts(snapshot.getContracts())
                    .assignments(List.of(snapshot.findAssignment("a-portal").orElseThrow()))
                    .calendar(snapshot.getCalendar())
                    .build();

            RollupNode second = engine.rollup(changed, List.of(RollupDimension.PROJECT), MAY_JUNE, RollupUnit.COST);

            assertNotSame(first, second);
            assertAmount("550", first.getTotalValue());
            assertAmount("100", second.getTotalValue());
        }

        @Test
        @DisplayName("snapshots without a version but with different data never share a tree")
        void unversionedSnapshots() {
            DateWindow june = DateWindow.of(date("2024-06-01"), date("2024-06-30"));
            StaffingSnapshot oneDay = StaffingSnapshot.builder()
                    .resources(List.of(resource("r1").build()))
                    .projects(List.of(project("p1").build()))
                    .assignments(List.of(assignment("a1", "r1", "p1").on("2024-06-05", 100).build()))
                    .build();
            StaffingSnapshot twoDays = StaffingSnapshot.builder()
                    .resources(List.of(resource("r1").build()))
                    .projects(List.of(project("p1").build()))
                    .assignments(List.of(assignment("a1", "r1", "p1").on("2024-06-05", 100).on("2024-06-06", 100).build()))
                    .build();

            assertEquals(oneDay.getVersion(), twoDays.getVersion());
            assertAmount("1", engine.rollup(oneDay, List.of(RollupDimension.PROJECT), june, RollupUnit.DAYS).getTotalValue());
            assertAmount("2", engine.rollup(twoDays, List.of(RollupDimension.PROJECT), june, RollupUnit.DAYS).getTotalValue());
        }

        @Test
        @DisplayName("an equal snapshot rebuilt from the same data hits the cache")
        void equalContent() throws IOException {
            RollupNode first = engine.rollup(snapshot, List.of(RollupDimension.HORIZONTAL), MAY_JUNE, RollupUnit.DAYS);

            assertSame(first, engine.rollup(read("/fixtures/staffing-snapshot.json"), List.of(RollupDimension.HORIZONTAL), MAY_JUNE, RollupUnit.DAYS));
        }

        @Test
        @DisplayName("invalidation drops cached trees")
        void invalidate() {
            RollupNode first = engine.rollup(snapshot, List.of(RollupDimension.LOCATION), MAY_JUNE, RollupUnit.FTE);

            engine.invalidateCaches();

            assertNotSame(first, engine.rollup(snapshot, List.of(RollupDimension.LOCATION), MAY_JUNE, RollupUnit.FTE));
        }
    }

    @Nested
    @DisplayName("assignment without allocation")
    class NullAllocation {

        private StaffingSnapshot empty;

        @BeforeEach
        void loadEmpty() throws IOException {
            empty = read("/fixtures/null-allocation.json");
        }

        @Test
        @DisplayName("is projected as having no load")
        void projection() {
            assertEquals(ProjectionState.NONE, engine.projectMonth(empty, "a-empty", YearMonth.of(2024, 9)).getState());
            MonthProjection june = engine.projectMonth(empty, "a-empty", YearMonth.of(2024, 6));
            assertEquals(ProjectionState.ACTUAL, june.getState());
            assertAmount("0", june.getPersonDays());
        }

        @Test
        @DisplayName("has no daily load and can be planned")
        void loadAndPlanning() {
            DateWindow june = DateWindow.of(date("2024-06-01"), date("2024-06-30"));
            assertTrue(engine.dailyLoad(empty, "r-milan", june).isEmpty());
            assertTrue(engine.overAllocations(empty, june).isEmpty());

            Assignment planned = engine.planRange(empty, "a-empty", date("2024-06-03"), date("2024-06-07"), 100);
            assertEquals(5, planned.getAllocation().size());
        }

        @Test
        @DisplayName("rolls up to an empty tree")
        void rollup() {
            RollupNode root = engine.rollup(empty, List.of(RollupDimension.RESOURCE), MAY_JUNE, RollupUnit.DAYS);

            assertAmount("0", root.getTotalValue());
            assertTrue(root.isLeaf());
        }
    }

    @Test
    @DisplayName("margins without a rate card show labour cost as a loss")
    void margins() {
        ProjectMargin data = engine.projectMargins(snapshot, null, MarginFilter.builder().clientId("c-city").build()).get(0);

        assertEquals("p-data", data.getProjectId());
        assertAmount("0", data.getRevenue());
        assertAmount("-450", data.getMargin());
        assertEquals(2, engine.monthlyMargins(snapshot, MAY_JUNE, MarginFilter.none()).size());
    }

    @Test
    @DisplayName("budget analysis applies realization")
    void budget() {
        ProjectBudgetAnalysis data = engine.budgetAnalysis(snapshot, null, "c-city").get(0);

        // 5 days at 100, billed at 90%
        assertAmount("450", data.getEstimatedCost());
        assertAmount("4550", data.getVariance());
    }

    @Test
    @DisplayName("utilization report through the facade")
    void utilization() {
        UtilizationRow rome = engine.utilization(snapshot, YearMonth.of(2024, 5), UtilizationFilter.builder().horizontal("Data").build()).get(0);

        assertAmount("18.4", rome.getAvailableDays());
        assertAmount("5", rome.getAllocatedDays());
        assertAmount("27.173913", rome.getUtilizationPercentage());
    }

    @Test
    @DisplayName("planning a range skips the resource's holidays and weekends")
    void planRange() {
        Assignment updated = engine.planRange(snapshot, "a-portal", date("2024-06-01"), date("2024-06-07"), 40);

        assertEquals(50, updated.getAllocation().percentageOn(date("2024-06-03")));
        assertNull(updated.getAllocation().percentageOn(date("2024-06-01")));
        assertEquals(40, updated.getAllocation().percentageOn(date("2024-06-04")));
        assertEquals(6, updated.getAllocation().size());
        // snapshot is unchanged
        assertEquals(2, snapshot.findAssignment("a-portal").orElseThrow().getAllocation().size());
    }

    @Test
    @DisplayName("full days above an 80% cap are reported as over-allocation")
    void overAllocations() {
        List<OverAllocation> result = engine.overAllocations(snapshot, MAY_JUNE);

        assertEquals(1, result.size());
        assertEquals("r-rome", result.get(0).getResourceId());
        assertEquals(5, result.get(0).getOverAllocatedDays().size());
        assertEquals(5, engine.dailyLoad(snapshot, "r-rome", MAY_JUNE).size());
    }
}
