package io.replicapacker.allocation.ordering;

import io.replicapacker.enums.ResourceDimension;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Tries every permutation of the dimensions. The sample budget and generator are ignored.
 */
public class ExhaustiveOrderingStrategy implements DimensionOrderingStrategy {
    
    @Override
    public List<List<ResourceDimension>> candidateOrderings(List<ResourceDimension> canonicalOrder, int sampleBudget, Random random) {
        return DimensionPermutations.all().stream()
            .filter(ordering -> !ordering.equals(canonicalOrder))
            .collect(Collectors.toList());
    }
    
    @Override
    public String getStrategyName() {
        return "Exhaustive";
    }
}
