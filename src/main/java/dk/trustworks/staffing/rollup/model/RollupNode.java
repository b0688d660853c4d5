package dk.trustworks.staffing.rollup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;

/**
 * One node of a rollup tree.
 *
 * <p>{@code totalValue} equals the sum of {@code monthlyValues}, and for every
 * non-leaf node also the sum of the children's totals. {@code monthlyValues} holds
 * every month of the requested window, keyed {@code yyyy-MM}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class RollupNode {

    public static final Comparator<RollupNode> BY_TOTAL_DESC = Comparator.comparing(RollupNode::getTotalValue).reversed()
            .thenComparing(RollupNode::getLabel, Comparator.nullsLast(Comparator.naturalOrder()));

    String id;
    String label;
    RollupDimension dimension;
    BigDecimal totalValue;
    SortedMap<String, BigDecimal> monthlyValues;
    List<RollupNode> children;

    public RollupNode(String id, String label, RollupDimension dimension, BigDecimal totalValue,
                      SortedMap<String, BigDecimal> monthlyValues, List<RollupNode> children) {
        this.id = id;
        this.label = label;
        this.dimension = dimension;
        this.totalValue = totalValue;
        this.monthlyValues = Collections.unmodifiableSortedMap(monthlyValues);
        this.children = List.copyOf(children);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Same tree with the children of every node ordered by {@code comparator}.
     */
    public RollupNode sorted(Comparator<RollupNode> comparator) {
        List<RollupNode> sortedChildren = children.stream()
                .map(child -> child.sorted(comparator))
                .sorted(comparator)
                .toList();
        return new RollupNode(id, label, dimension, totalValue, monthlyValues, sortedChildren);
    }

    /**
     * Depth-first lookup by id among this node and its descendants.
     */
    public RollupNode find(String nodeId) {
        if (nodeId.equals(id)) return this;
        for (RollupNode child : children) {
            RollupNode found = child.find(nodeId);
            if (found != null) return found;
        }
        return null;
    }
}
