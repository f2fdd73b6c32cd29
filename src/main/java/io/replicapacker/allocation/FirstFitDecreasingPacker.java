package io.replicapacker.allocation;

import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Plan;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * First-Fit Decreasing packer.
 * 
 * Flow:
 * 1. Validate the instance (capacity sanity, no replica larger than a server)
 * 2. Sort replicas by demand normalized to capacity, compared dimension by dimension
 *    in the given order, largest first. The sort is stable, so ties keep input order
 * 3. Place each replica on the first server, in creation order, that can host it
 * 4. Open a new server when none can
 * 
 * The packer holds no state between calls and uses no randomness: equal inputs give equal plans.
 */
@Slf4j
public class FirstFitDecreasingPacker {
    
    private static final String SERVER_ID_PREFIX = "S";
    
    private final FeasibilityChecker feasibilityChecker;
    
    public FirstFitDecreasingPacker() {
        this(new FeasibilityChecker());
    }
    
    public FirstFitDecreasingPacker(FeasibilityChecker feasibilityChecker) {
        this.feasibilityChecker = feasibilityChecker;
    }
    
    /**
     * Pack replicas onto as few servers as first-fit allows under one sort order.
     *
     * @param replicas replicas to place, in input order
     * @param capacity capacity of every server
     * @param dimensionOrder dimensions to sort by, most significant first; non-empty, no duplicates
     * @return servers in creation order
     * @throws PackingException if the instance is invalid or a replica can never be placed
     */
    public Plan pack(List<Replica> replicas, ResourceVector capacity, List<ResourceDimension> dimensionOrder)
            throws PackingException {
        Objects.requireNonNull(replicas, "replicas");
        Objects.requireNonNull(capacity, "capacity");
        validateDimensionOrder(dimensionOrder);
        PackingValidator.validate(replicas, capacity);
        
        if (replicas.isEmpty()) {
            return Plan.empty(capacity, dimensionOrder);
        }
        
        List<Replica> sorted = new ArrayList<>(replicas);
        sorted.sort(sortKeyComparator(capacity, dimensionOrder).reversed());
        
        List<Server> servers = new ArrayList<>();
        for (Replica replica : sorted) {
            Server target = null;
            for (Server server : servers) {
                if (feasibilityChecker.canHost(server, replica, capacity)) {
                    target = server;
                    break;
                }
            }
            
            if (target != null) {
                target.assign(replica);
            } else {
                servers.add(Server.open(SERVER_ID_PREFIX + (servers.size() + 1), replica));
            }
        }
        
        log.debug("FFD with order {} placed {} replicas on {} servers", 
                 dimensionOrder, replicas.size(), servers.size());
        return new Plan(servers, capacity, dimensionOrder);
    }
    
    /**
     * Ascending comparator over the normalized demand tuple. Callers reverse it for FFD.
     */
    static Comparator<Replica> sortKeyComparator(ResourceVector capacity, List<ResourceDimension> dimensionOrder) {
        return (a, b) -> {
            for (ResourceDimension dimension : dimensionOrder) {
                int cmp = Double.compare(normalized(a, dimension, capacity), normalized(b, dimension, capacity));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }
    
    private static double normalized(Replica replica, ResourceDimension dimension, ResourceVector capacity) {
        double cap = capacity.get(dimension);
        // Validation guarantees demand is 0 wherever capacity is 0
        return cap > 0 ? replica.getDemand().get(dimension) / cap : 0.0;
    }
    
    private static void validateDimensionOrder(List<ResourceDimension> dimensionOrder) {
        Objects.requireNonNull(dimensionOrder, "dimensionOrder");
        if (dimensionOrder.isEmpty()) {
            throw new IllegalArgumentException("Dimension order must name at least one dimension");
        }
        Set<ResourceDimension> seen = EnumSet.noneOf(ResourceDimension.class);
        for (ResourceDimension dimension : dimensionOrder) {
            if (dimension == null || !seen.add(dimension)) {
                throw new IllegalArgumentException("Dimension order must not contain null or repeated dimensions: " + dimensionOrder);
            }
        }
    }
}
