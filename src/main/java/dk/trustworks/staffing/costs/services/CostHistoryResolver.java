package dk.trustworks.staffing.costs.services;

import dk.trustworks.staffing.costs.model.Role;
import dk.trustworks.staffing.costs.model.RoleCostHistory;
import dk.trustworks.staffing.costs.model.RoleCostRecord;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves role costs from their SCD2 history.
 *
 * <p>A date before the first record, in a gap, or for an unknown role costs zero.
 * Historical reports still render in that case. The current cost of a role is never
 * used for a date a historical record covers.
 */
@JBossLog
public final class CostHistoryResolver implements RoleCostResolver {

    private final Map<String, RoleCostHistory> historyByRole;

    private CostHistoryResolver(Map<String, RoleCostHistory> historyByRole) {
        this.historyByRole = historyByRole;
    }

    public static CostHistoryResolver of(Collection<Role> roles) {
        Map<String, RoleCostHistory> index = new HashMap<>();
        for (Role role : roles) {
            if (role == null || role.getId() == null) continue;
            RoleCostHistory history = role.getCostHistory() == null ? RoleCostHistory.empty() : role.getCostHistory();
            if (!history.isConsistent()) {
                log.warnf("Cost history of role %s has overlapping or multiple open records, latest start date wins", role.getId());
            }
            index.put(role.getId(), history);
        }
        return new CostHistoryResolver(Map.copyOf(index));
    }

    public static CostHistoryResolver of(Map<String, RoleCostHistory> historyByRole) {
        return new CostHistoryResolver(Map.copyOf(historyByRole));
    }

    @Override
    public BigDecimal dailyCost(String roleId, LocalDate date) {
        if (roleId == null || date == null) return BigDecimal.ZERO;
        RoleCostHistory history = historyByRole.get(roleId);
        if (history == null) return BigDecimal.ZERO;
        return history.recordOn(date)
                .map(RoleCostRecord::getDailyCost)
                .orElse(BigDecimal.ZERO);
    }
}
