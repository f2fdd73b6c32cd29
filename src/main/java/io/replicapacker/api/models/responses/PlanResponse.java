package io.replicapacker.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import io.replicapacker.api.models.ResourceFields;
import io.replicapacker.models.Plan;
import io.replicapacker.models.Server;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Serialized plan, both the REST response and the persisted plan file:
 * {"capacity": {...}, "servers": [{"name", "services", "cpu", ...}]}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"capacity", "servers"})
public class PlanResponse {
    private ResourceFields capacity;
    private List<ServerEntry> servers;
    
    public static PlanResponse from(Plan plan) {
        return PlanResponse.builder()
            .capacity(ResourceFields.from(plan.getCapacity()))
            .servers(plan.getServers().stream()
                .map(ServerEntry::from)
                .collect(Collectors.toList()))
            .build();
    }
    
    /**
     * One server: its name, hosted services in lexicographic order, and final usage.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"name", "services"})
    public static class ServerEntry {
        private String name;
        private List<String> services;
        @JsonUnwrapped
        private ResourceFields usage;
        
        public static ServerEntry from(Server server) {
            return new ServerEntry(server.getId(), server.getSortedServiceNames(), ResourceFields.from(server.getUsage()));
        }
    }
}
