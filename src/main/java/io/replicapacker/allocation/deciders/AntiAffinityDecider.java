package io.replicapacker.allocation.deciders;

import io.replicapacker.enums.Decision;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;
import lombok.extern.slf4j.Slf4j;

/**
 * Service anti-affinity decider.
 * 
 * A server may host at most one replica of each service.
 * 
 * Decision logic:
 * - If the server already hosts the replica's service → NO
 * - Otherwise → YES
 */
@Slf4j
public class AntiAffinityDecider implements PlacementDecider {
    
    private boolean enabled = true;
    
    @Override
    public Decision canPlace(Server server, Replica replica, ResourceVector capacity) {
        if (server.hostsService(replica.getServiceName())) {
            log.trace("AntiAffinity: Server {} already hosts service {}, rejecting", 
                     server.getId(), replica.getServiceName());
            return Decision.NO;
        }
        return Decision.YES;
    }
    
    @Override
    public String getName() {
        return "AntiAffinityDecider";
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
