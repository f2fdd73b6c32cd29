package io.replicapacker.allocation;

import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Plan;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one ordering search: the winning plan and how it was found.
 */
@Getter
@ToString
@AllArgsConstructor
public class SearchResult {
    private final Plan bestPlan;
    private final List<ResourceDimension> canonicalOrder;
    private final Map<ResourceDimension, Double> criticality;
    private final int trialsEvaluated;
}
