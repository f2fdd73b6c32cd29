package io.replicapacker.allocation;

import io.replicapacker.allocation.deciders.AntiAffinityDecider;
import io.replicapacker.allocation.deciders.CapacityDecider;
import io.replicapacker.allocation.deciders.PlacementDecider;
import io.replicapacker.enums.Decision;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;

import java.util.List;

/**
 * Decides whether a server can admit one more replica.
 * 
 * Runs its deciders in order and stops at the first NO. The default chain checks
 * anti-affinity, then capacity.
 */
public class FeasibilityChecker {
    
    private final List<PlacementDecider> deciders;
    
    public FeasibilityChecker() {
        this(List.of(new AntiAffinityDecider(), new CapacityDecider()));
    }
    
    public FeasibilityChecker(List<PlacementDecider> deciders) {
        this.deciders = List.copyOf(deciders);
    }
    
    public boolean canHost(Server server, Replica replica, ResourceVector capacity) {
        for (PlacementDecider decider : deciders) {
            if (!decider.isEnabled()) {
                continue;
            }
            if (decider.canPlace(server, replica, capacity) == Decision.NO) {
                return false;
            }
        }
        return true;
    }
    
    public List<PlacementDecider> getDeciders() {
        return deciders;
    }
}
