package io.replicapacker.allocation;

import com.google.common.math.DoubleMath;
import io.replicapacker.models.Plan;

import java.util.Comparator;

/**
 * Orders plans from best to worst: fewer servers first, then less total spare capacity.
 * 
 * Plans that compare equal are interchangeable; the optimizer keeps whichever it found first.
 * Spare capacities within a relative tolerance of each other count as equal, so plans holding
 * the same replicas do not differ by the order their usage was summed in.
 */
public class PlanComparator implements Comparator<Plan> {
    
    private static final double RELATIVE_TOLERANCE = 1e-9;
    
    @Override
    public int compare(Plan a, Plan b) {
        int byServers = Integer.compare(a.getServerCount(), b.getServerCount());
        if (byServers != 0) {
            return byServers;
        }
        double spareA = a.getTotalSpareCapacity();
        double spareB = b.getTotalSpareCapacity();
        double tolerance = RELATIVE_TOLERANCE * Math.max(1.0, Math.max(Math.abs(spareA), Math.abs(spareB)));
        return DoubleMath.fuzzyCompare(spareA, spareB, tolerance);
    }
    
    /**
     * True only if {@code candidate} is strictly better than {@code best}.
     */
    public boolean isBetter(Plan candidate, Plan best) {
        return best == null || compare(candidate, best) < 0;
    }
}
