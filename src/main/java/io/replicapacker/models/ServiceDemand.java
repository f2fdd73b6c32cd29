package io.replicapacker.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A service with a replica count and the per-replica demand, as it appears in input data.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceDemand {
    
    private String serviceName;
    private int quantity;
    private ResourceVector demand;
    
    /**
     * Expand this row into {@code quantity} individual replicas.
     */
    public List<Replica> toReplicas() {
        if (quantity < 0) {
            throw new IllegalArgumentException("Service '" + serviceName + "' has negative quantity: " + quantity);
        }
        List<Replica> replicas = new ArrayList<>(quantity);
        for (int i = 0; i < quantity; i++) {
            replicas.add(new Replica(serviceName, demand));
        }
        return replicas;
    }
    
    /**
     * Expand rows in order, replicas of one row staying contiguous.
     */
    public static List<Replica> expandAll(List<ServiceDemand> services) {
        List<Replica> replicas = new ArrayList<>();
        for (ServiceDemand service : services) {
            replicas.addAll(service.toReplicas());
        }
        return replicas;
    }
}
