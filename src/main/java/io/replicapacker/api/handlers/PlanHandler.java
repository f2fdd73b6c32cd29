package io.replicapacker.api.handlers;

import io.replicapacker.allocation.PackingException;
import io.replicapacker.allocation.SearchResult;
import io.replicapacker.api.models.requests.PlanRequest;
import io.replicapacker.api.models.requests.ServiceRequest;
import io.replicapacker.api.models.responses.ErrorResponse;
import io.replicapacker.api.models.responses.PlanResponse;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ServiceDemand;
import io.replicapacker.planning.PlanManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API handler for placement planning.
 *
 * Supported operations:
 * - POST /_plan - Pack the given services onto as few servers as possible
 *
 * The response has the same shape as the persisted plan file.
 */
@Slf4j
@RestController
@RequestMapping("/_plan")
public class PlanHandler {

    private final PlanManager planManager;

    public PlanHandler(PlanManager planManager) {
        this.planManager = planManager;
    }

    /**
     * Create a placement plan.
     * POST /_plan
     */
    @PostMapping
    public ResponseEntity<Object> createPlan(@RequestBody PlanRequest request) {
        try {
            if (request.getCapacity() == null) {
                throw new IllegalArgumentException("Capacity is required");
            }
            List<ServiceDemand> services = request.getServices() == null ? List.of() 
                : request.getServices().stream()
                    .map(ServiceRequest::toServiceDemand)
                    .collect(Collectors.toList());
            List<Replica> replicas = ServiceDemand.expandAll(services);
            
            log.info("Creating plan for {} services ({} replicas)", services.size(), replicas.size());
            SearchResult result = planManager.createPlan(
                replicas, request.getCapacity().toVector(), request.getSeed(), request.getSampleBudget());
            return ResponseEntity.ok(PlanResponse.from(result.getBestPlan()));
        } catch (PackingException e) {
            log.error("Cannot pack request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.packingError(e.getClass().getSimpleName(), e.getMessage()));
        } catch (IllegalArgumentException e) {
            log.error("Invalid plan request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Error creating plan: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
