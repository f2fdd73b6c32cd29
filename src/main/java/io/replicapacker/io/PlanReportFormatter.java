package io.replicapacker.io;

import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Plan;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;

import java.util.Locale;

/**
 * Renders a plan as a plain-text utilization report.
 * 
 * <pre>
 * S1: api, db
 *   CPU          :     1.50 / 2.00  ( 75.0% used)
 *   ...
 * Total servers: 1
 * </pre>
 */
public class PlanReportFormatter {
    
    public String format(Plan plan) {
        ResourceVector capacity = plan.getCapacity();
        StringBuilder sb = new StringBuilder();
        sb.append("=== Assignment plan ===").append(System.lineSeparator()).append(System.lineSeparator());
        
        for (Server server : plan.getServers()) {
            sb.append(server.getId()).append(": ")
                .append(String.join(", ", server.getSortedServiceNames()))
                .append(System.lineSeparator());
            for (ResourceDimension dimension : ResourceDimension.values()) {
                sb.append(String.format(Locale.ROOT, "  %-13s: %8.2f / %.2f  (%5.1f%% used)",
                        dimension.getValue(),
                        server.getUsage().get(dimension),
                        capacity.get(dimension),
                        server.utilization(dimension, capacity) * 100))
                    .append(System.lineSeparator());
            }
            sb.append(System.lineSeparator());
        }
        
        sb.append("Total servers: ").append(plan.getServerCount());
        return sb.toString();
    }
}
