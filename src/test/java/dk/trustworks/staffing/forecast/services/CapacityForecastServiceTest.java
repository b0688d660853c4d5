package dk.trustworks.staffing.forecast.services;

import dk.trustworks.staffing.forecast.model.CapacityFilter;
import dk.trustworks.staffing.forecast.model.CapacityForecastMonth;
import dk.trustworks.staffing.model.StaffingSnapshot;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static dk.trustworks.staffing.utils.AssertionHelpers.assertAmount;
import static dk.trustworks.staffing.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@QuarkusTest
@DisplayName("CapacityForecastService")
class CapacityForecastServiceTest {

    private static final LocalDate TODAY = date("2024-06-15");
    private static final YearMonth JUNE = YearMonth.of(2024, 6);

    @Inject
    CapacityForecastService capacityForecastService;

    private final StaffingSnapshot snapshot = snapshot()
            .resource(resource("r1").horizontal("Digital").build())
            .resource(resource("r2").horizontal("Data").maxStaffingPercentage(50).build())
            .resource(resource("r3").horizontal("Digital").hireDate(date("2024-07-15")).build())
            .client(client("c1"))
            .client(client("c2"))
            .project(project("p1").clientId("c1").build())
            .project(project("p2").clientId("c2").build())
            .assignment(assignment("a1", "r1", "p1").weekdays("2024-05-01", "2024-06-30", 100))
            .assignment(assignment("a2", "r2", "p2").weekdays("2024-06-01", "2024-06-30", 50))
            .build();

    @Nested
    @DisplayName("whole workforce")
    class WholeWorkforce {

        @Test
        @DisplayName("current month is planned data only")
        void currentMonth() {
            CapacityForecastMonth june = capacityForecastService.forecast(snapshot, JUNE, 2, CapacityFilter.none(), TODAY).get(0);

            assertEquals(JUNE, june.getMonth());
            assertEquals(2, june.getResourceCount());
            assertAmount("30", june.getAvailablePersonDays());
            assertAmount("30", june.getAllocatedPersonDays());
            assertAmount("0", june.getProjectedPersonDays());
            assertAmount("100", june.getUtilizationPercentage());
            assertAmount("0", june.getSurplusDeficit());
            assertFalse(june.isOverbooked());
        }

        @Test
        @DisplayName("next month is projected from the run-rate and includes the new hire's capacity")
        void nextMonth() {
            CapacityForecastMonth july = capacityForecastService.forecast(snapshot, JUNE, 2, CapacityFilter.none(), TODAY).get(1);

            assertEquals(3, july.getResourceCount());
            // 23 + 23 * 50% + 13 days from the hire date
            assertAmount("47.5", july.getAvailablePersonDays());
            assertAmount("34.5", july.getAllocatedPersonDays());
            assertAmount("34.5", july.getProjectedPersonDays());
            assertAmount("72.631579", july.getUtilizationPercentage());
            assertAmount("13", july.getSurplusDeficit());
        }

        @Test
        @DisplayName("one row per month of the horizon")
        void horizon() {
            List<CapacityForecastMonth> forecast = capacityForecastService.forecast(snapshot, JUNE, 6, null, TODAY);

            assertEquals(6, forecast.size());
            assertEquals(YearMonth.of(2024, 11), forecast.get(5).getMonth());
        }
    }

    @Nested
    @DisplayName("filters")
    class Filters {

        @Test
        @DisplayName("by horizontal")
        void horizontal() {
            CapacityForecastMonth june = capacityForecastService.forecast(snapshot, JUNE, 1,
                    CapacityFilter.builder().horizontal("Data").build(), TODAY).get(0);

            assertEquals(1, june.getResourceCount());
            assertAmount("10", june.getAvailablePersonDays());
            assertAmount("10", june.getAllocatedPersonDays());
        }

        @Test
        @DisplayName("by client keeps the resources staffed on its projects")
        void client() {
            CapacityForecastMonth june = capacityForecastService.forecast(snapshot, JUNE, 1,
                    CapacityFilter.builder().clientId("c1").build(), TODAY).get(0);

            assertEquals(1, june.getResourceCount());
            assertAmount("20", june.getAvailablePersonDays());
        }

        @Test
        @DisplayName("project wins over client")
        void projectWins() {
            CapacityForecastMonth june = capacityForecastService.forecast(snapshot, JUNE, 1,
                    CapacityFilter.builder().clientId("c1").projectId("p2").build(), TODAY).get(0);

            assertAmount("10", june.getAvailablePersonDays());
            assertAmount("10", june.getAllocatedPersonDays());
        }
    }

    @Test
    @DisplayName("an empty horizon is rejected")
    void emptyHorizon() {
        assertThrows(IllegalArgumentException.class, () -> capacityForecastService.forecast(snapshot, JUNE, 0, CapacityFilter.none(), TODAY));
    }
}
