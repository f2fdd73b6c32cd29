package io.replicapacker.allocation.ordering;

import io.replicapacker.enums.ResourceDimension;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Evaluates a fixed list of orderings chosen up front, for example the
 * CPU, Network, Memory order used before criticality ranking existed.
 * The sample budget caps how many of them are used.
 */
public class FixedOrderingStrategy implements DimensionOrderingStrategy {
    
    public static final List<ResourceDimension> LEGACY_ORDER =
        List.of(ResourceDimension.CPU, ResourceDimension.NETWORK, ResourceDimension.MEMORY);
    
    private final List<List<ResourceDimension>> orderings;
    
    public FixedOrderingStrategy(List<List<ResourceDimension>> orderings) {
        this.orderings = orderings.stream()
            .map(List::copyOf)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<List<ResourceDimension>> candidateOrderings(List<ResourceDimension> canonicalOrder, int sampleBudget, Random random) {
        return new LinkedHashSet<>(orderings).stream()
            .filter(ordering -> !ordering.equals(canonicalOrder))
            .limit(Math.max(sampleBudget, 0))
            .collect(Collectors.toList());
    }
    
    @Override
    public String getStrategyName() {
        return "Fixed";
    }
}
