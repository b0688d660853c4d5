package dk.trustworks.staffing.costs.services;

import dk.trustworks.staffing.costs.model.RateCard;
import dk.trustworks.staffing.costs.model.RateCardEntry;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the daily sell rate of a resource on a rate card. No rate card, an unknown
 * card or a resource without an entry sells at zero.
 */
@JBossLog
public final class SellRateResolver {

    private final Map<String, Map<String, BigDecimal>> ratesByCard;

    private SellRateResolver(Map<String, Map<String, BigDecimal>> ratesByCard) {
        this.ratesByCard = ratesByCard;
    }

    public static SellRateResolver of(Collection<RateCard> rateCards) {
        Map<String, Map<String, BigDecimal>> index = new HashMap<>();
        for (RateCard card : rateCards) {
            if (card == null || card.getId() == null) continue;
            Map<String, BigDecimal> rates = new HashMap<>();
            for (RateCardEntry entry : card.getEntries() == null ? List.<RateCardEntry>of() : card.getEntries()) {
                if (entry == null || entry.getResourceId() == null || entry.getDailyRate() == null) continue;
                if (rates.put(entry.getResourceId(), entry.getDailyRate()) != null) {
                    log.warnf("Rate card %s has more than one rate for resource %s, the last one wins", card.getId(), entry.getResourceId());
                }
            }
            index.put(card.getId(), Map.copyOf(rates));
        }
        return new SellRateResolver(Map.copyOf(index));
    }

    public BigDecimal sellRate(String rateCardId, String resourceId) {
        if (rateCardId == null || resourceId == null) return BigDecimal.ZERO;
        Map<String, BigDecimal> rates = ratesByCard.get(rateCardId);
        if (rates == null) return BigDecimal.ZERO;
        return rates.getOrDefault(resourceId, BigDecimal.ZERO);
    }
}
