package io.replicapacker.allocation.ordering;

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.math.IntMath;
import io.replicapacker.enums.ResourceDimension;

import java.util.EnumSet;
import java.util.List;

/**
 * The full permutation space of the resource dimensions.
 */
public final class DimensionPermutations {
    
    private static final List<List<ResourceDimension>> ALL = Collections2
        .orderedPermutations(EnumSet.allOf(ResourceDimension.class))
        .stream()
        .map(ImmutableList::copyOf)
        .collect(ImmutableList.toImmutableList());
    
    private DimensionPermutations() {
        // Utility class
    }
    
    /**
     * Every ordering of all dimensions, in lexicographic order of declaration.
     */
    public static List<List<ResourceDimension>> all() {
        return ALL;
    }
    
    /**
     * Size of the permutation space, i.e. the factorial of the dimension count.
     */
    public static int count() {
        return IntMath.factorial(ResourceDimension.values().length);
    }
}
