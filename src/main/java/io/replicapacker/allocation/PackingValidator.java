package io.replicapacker.allocation;

import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;

import java.util.List;

/**
 * Rejects instances that no packing could satisfy, before any server is opened.
 */
public final class PackingValidator {
    
    private PackingValidator() {
        // Utility class
    }
    
    /**
     * Validate the capacity first, then every replica against it.
     *
     * @throws InvalidCapacityException if a capacity entry is negative, or zero while some replica needs that resource
     * @throws UnplaceableReplicaException if a replica alone exceeds the capacity in some dimension
     */
    public static void validate(List<Replica> replicas, ResourceVector capacity) throws PackingException {
        validateCapacity(replicas, capacity);
        
        for (Replica replica : replicas) {
            for (ResourceDimension dimension : ResourceDimension.values()) {
                if (replica.getDemand().get(dimension) > capacity.get(dimension)) {
                    throw new UnplaceableReplicaException(replica, dimension, capacity.get(dimension));
                }
            }
        }
    }
    
    private static void validateCapacity(List<Replica> replicas, ResourceVector capacity) throws InvalidCapacityException {
        for (ResourceDimension dimension : ResourceDimension.values()) {
            double cap = capacity.get(dimension);
            if (cap < 0) {
                throw new InvalidCapacityException(dimension, cap, "capacity must not be negative");
            }
            if (cap == 0) {
                for (Replica replica : replicas) {
                    if (replica.getDemand().get(dimension) > 0) {
                        throw new InvalidCapacityException(dimension, cap,
                            "service '" + replica.getServiceName() + "' needs this resource");
                    }
                }
            }
        }
    }
}
