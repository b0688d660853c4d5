package dk.trustworks.staffing.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class StaffingEngineConfig {

    // FTE approximation: one person-day is 1/20 FTE regardless of the month
    @ConfigProperty(name = "staffing.fte.reference-working-days-per-month", defaultValue = "20")
    int referenceWorkingDaysPerMonth;

    @ConfigProperty(name = "staffing.forecast.lookback-months", defaultValue = "2")
    int forecastLookbackMonths;

    @ConfigProperty(name = "staffing.forecast.max-scan-months", defaultValue = "12")
    int forecastMaxScanMonths;

    // Scale used for every non-terminating division (FTE, run-rate, utilization)
    @ConfigProperty(name = "staffing.calc.scale", defaultValue = "6")
    int calculationScale;

    @ConfigProperty(name = "staffing.clock.zone", defaultValue = "Europe/Rome")
    String clockZone;

    @ConfigProperty(name = "staffing.clock.fixed-date")
    Optional<String> fixedDate;

    public int getReferenceWorkingDaysPerMonth() {
        return referenceWorkingDaysPerMonth;
    }

    public int getForecastLookbackMonths() {
        return forecastLookbackMonths;
    }

    public int getForecastMaxScanMonths() {
        return forecastMaxScanMonths;
    }

    public int getCalculationScale() {
        return calculationScale;
    }

    public String getClockZone() {
        return clockZone;
    }

    public Optional<String> getFixedDate() {
        return fixedDate;
    }
}
