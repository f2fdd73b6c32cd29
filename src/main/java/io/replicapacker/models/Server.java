package io.replicapacker.models;

import io.replicapacker.enums.ResourceDimension;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A physical server being filled during one packing run.
 * 
 * Usage only grows. Callers are expected to check feasibility before {@link #assign(Replica)};
 * the server itself only enforces anti-affinity.
 */
@Getter
public class Server {
    
    private final String id;
    private ResourceVector usage;
    private final Set<String> hostedServices = new LinkedHashSet<>();
    private final List<Replica> assignedReplicas = new ArrayList<>();
    
    private Server(String id) {
        this.id = id;
        this.usage = ResourceVector.zero();
    }
    
    /**
     * Open a new server seeded with its first replica.
     */
    public static Server open(String id, Replica firstReplica) {
        Server server = new Server(id);
        server.assign(firstReplica);
        return server;
    }
    
    public void assign(Replica replica) {
        if (!hostedServices.add(replica.getServiceName())) {
            throw new IllegalStateException("Server " + id + " already hosts a replica of service '"
                + replica.getServiceName() + "'");
        }
        assignedReplicas.add(replica);
        usage = usage.plus(replica.getDemand());
    }
    
    public boolean hostsService(String serviceName) {
        return hostedServices.contains(serviceName);
    }
    
    public Set<String> getHostedServices() {
        return Collections.unmodifiableSet(hostedServices);
    }
    
    public List<Replica> getAssignedReplicas() {
        return Collections.unmodifiableList(assignedReplicas);
    }
    
    /**
     * Hosted service names in lexicographic order, as reports display them.
     */
    public List<String> getSortedServiceNames() {
        return new ArrayList<>(new TreeSet<>(hostedServices));
    }
    
    /**
     * Fraction of {@code capacity} used in one dimension, 0 when the capacity is 0.
     */
    public double utilization(ResourceDimension dimension, ResourceVector capacity) {
        double cap = capacity.get(dimension);
        return cap > 0 ? usage.get(dimension) / cap : 0.0;
    }
    
    @Override
    public String toString() {
        return id + getSortedServiceNames() + " usage=" + usage;
    }
}
