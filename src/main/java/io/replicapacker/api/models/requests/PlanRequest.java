package io.replicapacker.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.replicapacker.api.models.ResourceFields;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for POST /_plan.
 * Seed and sample budget are optional and default to the configured values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlanRequest {
    private ResourceFields capacity;
    @Builder.Default
    private List<ServiceRequest> services = new ArrayList<>();
    private Long seed;
    private Integer sampleBudget;
}
