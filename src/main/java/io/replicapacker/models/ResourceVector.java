package io.replicapacker.models;

import io.replicapacker.enums.ResourceDimension;

import java.util.Arrays;

/**
 * Immutable tuple of one value per {@link ResourceDimension}.
 * 
 * Used for replica demand, server capacity and server usage alike.
 */
public final class ResourceVector {
    
    public static final int DIMENSIONS = ResourceDimension.values().length;
    
    private static final ResourceVector ZERO = new ResourceVector(new double[DIMENSIONS]);
    
    private final double[] values;
    
    private ResourceVector(double[] values) {
        this.values = values;
    }
    
    public static ResourceVector of(double cpu, double memory, double network, double diskIo, double storage) {
        return fromArray(new double[]{cpu, memory, network, diskIo, storage});
    }
    
    public static ResourceVector zero() {
        return ZERO;
    }
    
    /**
     * Build a vector from an array indexed by {@link ResourceDimension#ordinal()}.
     *
     * @throws IllegalArgumentException if the array has the wrong length or a non-finite value
     */
    public static ResourceVector fromArray(double[] values) {
        if (values == null || values.length != DIMENSIONS) {
            throw new IllegalArgumentException("Resource vector requires exactly " + DIMENSIONS + " values");
        }
        double[] copy = values.clone();
        for (ResourceDimension dimension : ResourceDimension.values()) {
            double value = copy[dimension.ordinal()];
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Resource value for " + dimension.getValue() + " must be finite, got " + value);
            }
        }
        return new ResourceVector(copy);
    }
    
    public double get(ResourceDimension dimension) {
        return values[dimension.ordinal()];
    }
    
    public ResourceVector plus(ResourceVector other) {
        double[] sum = new double[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            sum[i] = values[i] + other.values[i];
        }
        return new ResourceVector(sum);
    }
    
    /**
     * Sum of all components. Units differ per dimension, so this is only meaningful as a relative score.
     */
    public double total() {
        double total = 0;
        for (double value : values) {
            total += value;
        }
        return total;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceVector)) return false;
        return Arrays.equals(values, ((ResourceVector) o).values);
    }
    
    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (ResourceDimension dimension : ResourceDimension.values()) {
            if (dimension.ordinal() > 0) {
                sb.append(", ");
            }
            sb.append(dimension.getValue()).append('=').append(values[dimension.ordinal()]);
        }
        return sb.append('}').toString();
    }
}
