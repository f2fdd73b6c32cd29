package io.replicapacker.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.replicapacker.api.models.responses.PlanResponse;
import io.replicapacker.models.Plan;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists a plan as pretty-printed JSON.
 */
@Slf4j
public class PlanWriter {
    
    private final ObjectMapper objectMapper;
    
    public PlanWriter() {
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    }
    
    public void write(Plan plan, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(path.toFile(), PlanResponse.from(plan));
        log.info("Wrote plan with {} servers to {}", plan.getServerCount(), path);
    }
    
    public PlanResponse read(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), PlanResponse.class);
    }
}
