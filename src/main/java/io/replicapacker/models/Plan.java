package io.replicapacker.models;

import io.replicapacker.enums.ResourceDimension;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One complete assignment of replicas to servers, in server creation order.
 */
@Getter
@ToString
public class Plan {
    
    private final List<Server> servers;
    private final ResourceVector capacity;
    private final List<ResourceDimension> dimensionOrder;
    
    public Plan(List<Server> servers, ResourceVector capacity, List<ResourceDimension> dimensionOrder) {
        this.servers = Collections.unmodifiableList(new ArrayList<>(servers));
        this.capacity = capacity;
        this.dimensionOrder = List.copyOf(dimensionOrder);
    }
    
    public static Plan empty(ResourceVector capacity, List<ResourceDimension> dimensionOrder) {
        return new Plan(List.of(), capacity, dimensionOrder);
    }
    
    public int getServerCount() {
        return servers.size();
    }
    
    public boolean isEmpty() {
        return servers.isEmpty();
    }
    
    /**
     * Sum of usage over all servers.
     */
    public ResourceVector getTotalUsage() {
        ResourceVector total = ResourceVector.zero();
        for (Server server : servers) {
            total = total.plus(server.getUsage());
        }
        return total;
    }
    
    /**
     * Unused capacity in one dimension: {@code capacity * serverCount - totalUsage}.
     */
    public double getSpareCapacity(ResourceDimension dimension) {
        return capacity.get(dimension) * servers.size() - getTotalUsage().get(dimension);
    }
    
    /**
     * Spare capacity summed over all dimensions. Tie-break score between plans of equal size.
     */
    public double getTotalSpareCapacity() {
        return capacity.total() * servers.size() - getTotalUsage().total();
    }
    
    /**
     * Replicas in server order, then assignment order within each server.
     */
    public List<Replica> getAllReplicas() {
        return servers.stream()
            .flatMap(server -> server.getAssignedReplicas().stream())
            .collect(Collectors.toList());
    }
    
    /**
     * Service names per server, sorted within each server.
     */
    public List<List<String>> getGrouping() {
        return servers.stream()
            .map(Server::getSortedServiceNames)
            .collect(Collectors.toList());
    }
}
