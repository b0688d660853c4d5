package dk.trustworks.staffing.config;

import dk.trustworks.staffing.utils.DateUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import lombok.extern.jbosslog.JBossLog;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Supplies the clock the forecast uses to tell past months from future ones.
 * A fixed date can be configured for tests and for "as of" report runs.
 */
@JBossLog
@ApplicationScoped
public class ClockProducer {

    @Inject
    StaffingEngineConfig config;

    @Produces
    @Singleton
    Clock clock() {
        ZoneId zone = ZoneId.of(config.getClockZone());
        return config.getFixedDate()
                .map(DateUtils::dateIt)
                .map(date -> {
                    log.infof("Using fixed clock at %s (%s)", date, zone);
                    return Clock.fixed(date.atStartOfDay(zone).toInstant(), zone);
                })
                .orElseGet(() -> Clock.system(zone));
    }
}
