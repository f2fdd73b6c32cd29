package io.replicapacker.allocation.ordering;

import io.replicapacker.enums.ResourceDimension;

import java.util.List;
import java.util.Random;

/**
 * Strategy interface for producing the dimension orderings the optimizer tries
 * in addition to the canonical (criticality) order.
 * 
 * Different implementations:
 * - RandomSampleOrderingStrategy: seeded sample of permutations without replacement
 * - ExhaustiveOrderingStrategy: every permutation
 * - FixedOrderingStrategy: a caller-chosen list
 */
public interface DimensionOrderingStrategy {
    
    /**
     * Produce candidate orderings, never including the canonical order itself.
     * 
     * @param canonicalOrder the order the optimizer always evaluates first
     * @param sampleBudget upper bound on the number of orderings wanted (strategies may ignore it)
     * @param random generator owned by the caller, the only source of randomness allowed
     * @return orderings to evaluate, in evaluation order, without duplicates
     */
    List<List<ResourceDimension>> candidateOrderings(List<ResourceDimension> canonicalOrder, int sampleBudget, Random random);
    
    /**
     * Get the name of this strategy (for logging).
     */
    String getStrategyName();
}
