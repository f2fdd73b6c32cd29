package io.replicapacker.allocation.ordering;

import io.replicapacker.enums.ResourceDimension;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Random permutation sampling strategy.
 * 
 * Draws {@code min(sampleBudget, 5!)} permutations without replacement by shuffling the
 * full permutation space with the caller's generator, then drops the canonical order
 * so it is not evaluated twice. Same seed, same sample.
 */
@Slf4j
public class RandomSampleOrderingStrategy implements DimensionOrderingStrategy {
    
    @Override
    public List<List<ResourceDimension>> candidateOrderings(List<ResourceDimension> canonicalOrder, int sampleBudget, Random random) {
        int sampleSize = Math.min(sampleBudget, DimensionPermutations.count());
        if (sampleSize <= 0) {
            return List.of();
        }
        
        List<List<ResourceDimension>> shuffled = new ArrayList<>(DimensionPermutations.all());
        Collections.shuffle(shuffled, random);
        
        List<List<ResourceDimension>> sample = shuffled.stream()
            .limit(sampleSize)
            .filter(ordering -> !ordering.equals(canonicalOrder))
            .collect(Collectors.toList());
        
        log.debug("Random strategy sampled {} orderings (budget {}, {} after removing canonical)", 
                 sampleSize, sampleBudget, sample.size());
        return sample;
    }
    
    @Override
    public String getStrategyName() {
        return "Random";
    }
}
