package io.replicapacker.allocation;

import io.replicapacker.enums.ResourceDimension;
import lombok.Getter;

/**
 * Thrown when the server capacity is negative in some dimension, or zero where replicas need that resource.
 */
@Getter
public class InvalidCapacityException extends PackingException {
    
    private final ResourceDimension dimension;
    private final double capacity;
    
    public InvalidCapacityException(ResourceDimension dimension, double capacity, String reason) {
        super(String.format("Invalid %s capacity %s: %s", dimension.getValue(), capacity, reason));
        this.dimension = dimension;
        this.capacity = capacity;
    }
}
