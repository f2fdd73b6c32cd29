package io.replicapacker.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.replicapacker.api.models.responses.PlanResponse;
import io.replicapacker.models.Plan;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.replicapacker.enums.ResourceDimension.CPU;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for PlanWriter.
 */
class PlanWriterTest {

    private static final ResourceVector CAPACITY = ResourceVector.of(2, 8, 100, 50, 200);

    @TempDir
    Path tempDir;

    private final PlanWriter writer = new PlanWriter();

    @Test
    void testWritesPlanFile() throws Exception {
        // Given
        Server first = Server.open("S1", new Replica("db", ResourceVector.of(1, 2, 50, 10, 50)));
        first.assign(new Replica("api", ResourceVector.of(0.5, 2, 10, 10, 50)));
        Server second = Server.open("S2", new Replica("db", ResourceVector.of(1, 2, 50, 10, 50)));
        Plan plan = new Plan(List.of(first, second), CAPACITY, List.of(CPU));
        Path output = tempDir.resolve("nested").resolve("plan.json");

        // When
        writer.write(plan, output);

        // Then
        assertThat(output).exists();
        JsonNode json = new ObjectMapper().readTree(Files.readString(output));
        assertThat(json.get("capacity").get("disk_io").asDouble()).isEqualTo(50.0);
        assertThat(json.get("servers")).hasSize(2);
        JsonNode server = json.get("servers").get(0);
        assertThat(server.get("name").asText()).isEqualTo("S1");
        assertThat(server.get("services").get(0).asText()).isEqualTo("api");
        assertThat(server.get("services").get(1).asText()).isEqualTo("db");
        assertThat(server.get("cpu").asDouble()).isEqualTo(1.5);
        assertThat(server.get("storage").asDouble()).isEqualTo(100.0);
    }

    @Test
    void testReadsBackWrittenPlan() throws Exception {
        Server server = Server.open("S1", new Replica("db", ResourceVector.of(1, 2, 50, 10, 50)));
        Plan plan = new Plan(List.of(server), CAPACITY, List.of(CPU));
        Path output = tempDir.resolve("plan.json");

        writer.write(plan, output);
        PlanResponse read = writer.read(output);

        assertThat(read).isEqualTo(PlanResponse.from(plan));
        assertThat(read.getServers().get(0).getUsage().toVector()).isEqualTo(ResourceVector.of(1, 2, 50, 10, 50));
    }
}
