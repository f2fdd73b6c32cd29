package io.replicapacker.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.replicapacker.api.models.ResourceFields;
import io.replicapacker.models.ServiceDemand;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One service in a plan request: its name, replica count and per-replica demand.
 * Demand fields sit next to the name, e.g. {"name": "api", "quantity": 3, "cpu": 0.5, ...}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceRequest {
    private String name;
    private int quantity = 1;
    @JsonUnwrapped
    private ResourceFields demand = new ResourceFields();
    
    public ServiceDemand toServiceDemand() {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service name is required");
        }
        if (demand == null) {
            throw new IllegalArgumentException("Service '" + name + "' has no demand");
        }
        return new ServiceDemand(name, quantity, demand.toVector());
    }
}
