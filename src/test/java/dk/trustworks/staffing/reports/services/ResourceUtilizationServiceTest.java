package dk.trustworks.staffing.reports.services;

import dk.trustworks.staffing.model.StaffingSnapshot;
import dk.trustworks.staffing.reports.model.UtilizationFilter;
import dk.trustworks.staffing.reports.model.UtilizationRow;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.YearMonth;
import java.util.List;

import static dk.trustworks.staffing.utils.AssertionHelpers.assertAmount;
import static dk.trustworks.staffing.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@DisplayName("ResourceUtilizationService")
class ResourceUtilizationServiceTest {

    private static final YearMonth JUNE = YearMonth.of(2024, 6);

    @Inject
    ResourceUtilizationService utilizationService;

    private final StaffingSnapshot snapshot = snapshot()
            .resource(resource("r1").build())
            .resource(resource("r2").location(ROME).horizontal("Data").roleId("role-analyst").maxStaffingPercentage(80).build())
            .resource(resource("r3").resigned(true).lastDayOfWork(date("2024-06-20")).build())
            .resource(resource("r4").hireDate(date("2024-06-17")).build())
            .role(role(ROLE_CONSULTANT, cost(100, "2024-01-01", null)))
            .role(role("role-analyst", cost(50, "2024-01-01", null)))
            .project(project("p1").build())
            .assignment(assignment("a1", "r1", "p1").weekdays("2024-06-01", "2024-06-30", 100))
            .assignment(assignment("a2", "r2", "p1").weekdays("2024-06-10", "2024-06-14", 100))
            .assignment(assignment("a3", "r3", "p1").weekdays("2024-06-10", "2024-06-14", 100))
            .event(localHoliday("2024-06-03", MILAN))
            .build();

    private UtilizationRow row(List<UtilizationRow> rows, String resourceId) {
        return rows.stream().filter(r -> r.getResourceId().equals(resourceId)).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("resigned resources are left out, new hires count from their hire date")
    void population() {
        List<UtilizationRow> rows = utilizationService.monthlyReport(snapshot, JUNE, UtilizationFilter.none());

        assertEquals(List.of("r1", "r2", "r4"), rows.stream().map(UtilizationRow::getResourceId).toList());
        assertEquals(10, row(rows, "r4").getWorkingDays());
        assertAmount("0", row(rows, "r4").getUtilizationPercentage());
    }

    @Test
    @DisplayName("allocation on a local holiday is not counted against capacity")
    void fullyBooked() {
        UtilizationRow r1 = row(utilizationService.monthlyReport(snapshot, JUNE, null), "r1");

        assertEquals(19, r1.getWorkingDays());
        assertAmount("19", r1.getAvailableDays());
        assertAmount("19", r1.getAllocatedDays());
        assertAmount("1900", r1.getAllocatedCost());
        assertAmount("100", r1.getUtilizationPercentage());
    }

    @Test
    @DisplayName("available days respect the staffing cap")
    void staffingCap() {
        UtilizationRow r2 = row(utilizationService.monthlyReport(snapshot, JUNE, null), "r2");

        assertAmount("16", r2.getAvailableDays());
        assertAmount("5", r2.getAllocatedDays());
        assertAmount("250", r2.getAllocatedCost());
        assertAmount("31.25", r2.getUtilizationPercentage());
    }

    @Test
    @DisplayName("filter by role and horizontal")
    void filters() {
        assertEquals(1, utilizationService.monthlyReport(snapshot, JUNE, UtilizationFilter.builder().roleId("role-analyst").build()).size());
        assertEquals(2, utilizationService.monthlyReport(snapshot, JUNE, UtilizationFilter.builder().horizontal("Digital").build()).size());
    }
}
