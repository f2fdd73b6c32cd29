package io.replicapacker.models;

import io.replicapacker.enums.ResourceDimension;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * One replica of a service together with the resources it needs.
 * 
 * Several replicas usually share a service name. Replicas are compared by identity:
 * two replicas of the same service with the same demand are still distinct units to place.
 */
@Getter
@ToString
public final class Replica {
    
    private final String serviceName;
    private final ResourceVector demand;
    
    public Replica(String serviceName, ResourceVector demand) {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(demand, "demand");
        if (serviceName.isBlank()) {
            throw new IllegalArgumentException("Replica service name must not be blank");
        }
        for (ResourceDimension dimension : ResourceDimension.values()) {
            if (demand.get(dimension) < 0) {
                throw new IllegalArgumentException("Replica of service '" + serviceName + "' has negative "
                    + dimension.getValue() + " demand: " + demand.get(dimension));
            }
        }
        this.serviceName = serviceName;
        this.demand = demand;
    }
}
