package io.replicapacker.api.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.ResourceVector;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The five resource values as named JSON fields: cpu, memory, network, disk_io, storage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"cpu", "memory", "network", "disk_io", "storage"})
public class ResourceFields {
    private double cpu;
    private double memory;
    private double network;
    private double diskIo;
    private double storage;
    
    public static ResourceFields from(ResourceVector vector) {
        return ResourceFields.builder()
            .cpu(vector.get(ResourceDimension.CPU))
            .memory(vector.get(ResourceDimension.MEMORY))
            .network(vector.get(ResourceDimension.NETWORK))
            .diskIo(vector.get(ResourceDimension.DISK_IO))
            .storage(vector.get(ResourceDimension.STORAGE))
            .build();
    }
    
    public ResourceVector toVector() {
        return ResourceVector.of(cpu, memory, network, diskIo, storage);
    }
}
