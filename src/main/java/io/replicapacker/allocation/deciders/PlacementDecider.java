package io.replicapacker.allocation.deciders;

import io.replicapacker.enums.Decision;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;

/**
 * Interface for placement decision making.
 * 
 * Each PlacementDecider implements one rule for determining whether a replica
 * can be added to a server that is already partially filled. Deciders must not
 * mutate the server.
 */
public interface PlacementDecider {
    
    /**
     * Determine if a replica can be placed on a server.
     * 
     * @param server the candidate server with its current usage
     * @param replica the replica to place
     * @param capacity the capacity shared by every server
     * @return placement decision
     */
    Decision canPlace(Server server, Replica replica, ResourceVector capacity);
    
    /**
     * Get the name of this decider.
     */
    String getName();
    
    /**
     * Check if this decider is enabled.
     */
    boolean isEnabled();
    
    /**
     * Enable or disable this decider.
     */
    void setEnabled(boolean enabled);
}
