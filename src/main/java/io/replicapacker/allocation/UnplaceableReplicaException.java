package io.replicapacker.allocation;

import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Replica;
import lombok.Getter;

/**
 * Thrown when a replica needs more of one resource than an empty server offers,
 * so no number of servers could ever host it.
 */
@Getter
public class UnplaceableReplicaException extends PackingException {
    
    private final Replica replica;
    private final ResourceDimension dimension;
    
    public UnplaceableReplicaException(Replica replica, ResourceDimension dimension, double capacity) {
        super(String.format("Replica of service '%s' cannot be placed: %s demand %s exceeds server capacity %s",
            replica.getServiceName(), dimension.getValue(), replica.getDemand().get(dimension), capacity));
        this.replica = replica;
        this.dimension = dimension;
    }
    
    public String getServiceName() {
        return replica.getServiceName();
    }
}
