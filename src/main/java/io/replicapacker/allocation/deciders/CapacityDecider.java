package io.replicapacker.allocation.deciders;

import io.replicapacker.enums.Decision;
import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;
import lombok.extern.slf4j.Slf4j;

/**
 * Capacity decider.
 * 
 * Accepts a replica only if, in every dimension, the server's current usage plus
 * the replica's demand stays within capacity. Reaching capacity exactly is allowed.
 */
@Slf4j
public class CapacityDecider implements PlacementDecider {
    
    private boolean enabled = true;
    
    @Override
    public Decision canPlace(Server server, Replica replica, ResourceVector capacity) {
        ResourceVector usage = server.getUsage();
        ResourceVector demand = replica.getDemand();
        
        for (ResourceDimension dimension : ResourceDimension.values()) {
            if (usage.get(dimension) + demand.get(dimension) > capacity.get(dimension)) {
                log.trace("Capacity: Server {} cannot take replica of {} ({} {} + {} > {})", 
                         server.getId(), replica.getServiceName(), dimension.getValue(),
                         usage.get(dimension), demand.get(dimension), capacity.get(dimension));
                return Decision.NO;
            }
        }
        return Decision.YES;
    }
    
    @Override
    public String getName() {
        return "CapacityDecider";
    }
    
    @Override
    public boolean isEnabled() {
        return enabled;
    }
    
    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
