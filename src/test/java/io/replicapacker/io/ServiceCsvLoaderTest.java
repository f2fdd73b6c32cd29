package io.replicapacker.io;

import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.ServiceDemand;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ServiceCsvLoader.
 */
class ServiceCsvLoaderTest {

    private static final String HEADER =
        "Servicios,Cantidad,USO CPU (%),E/S Red (Mbs),E/S disco (MB/s),Uso Disco (GB),Memoria (GB)\n";

    private final ServiceCsvLoader loader = new ServiceCsvLoader();

    @Test
    void testLoadsInventoryFile() throws Exception {
        // Given
        Path path = Paths.get(getClass().getClassLoader().getResource("services.csv").toURI());

        // When
        List<ServiceDemand> services = loader.load(path);

        // Then
        assertThat(services).extracting(ServiceDemand::getServiceName).containsExactly("api", "db", "cache");
        assertThat(services).extracting(ServiceDemand::getQuantity).containsExactly(3, 2, 2);
        assertThat(services.get(0).getDemand()).isEqualTo(ResourceVector.of(1.5, 4, 100, 20, 50));
        assertThat(services.get(1).getDemand()).isEqualTo(ResourceVector.of(3, 16, 200, 120, 500));
        assertThat(ServiceDemand.expandAll(services)).extracting(Replica::getServiceName)
            .containsExactly("api", "api", "api", "db", "db", "cache", "cache");
    }

    @Test
    void testColumnOrderAndHeaderSpacesDoNotMatter() throws Exception {
        String csv = "Cantidad, Servicios ,Memoria (GB),USO CPU (%),E/S Red (Mbs),E/S disco (MB/s),Uso Disco (GB)\n"
            + "2,web,1.5,25,10,5,20\n";

        List<ServiceDemand> services = loader.load(new StringReader(csv));

        assertThat(services).hasSize(1);
        assertThat(services.get(0).getServiceName()).isEqualTo("web");
        assertThat(services.get(0).getDemand()).isEqualTo(ResourceVector.of(0.25, 1.5, 10, 5, 20));
    }

    @Test
    void testZeroQuantityIsAllowed() throws Exception {
        List<ServiceDemand> services = loader.load(new StringReader(HEADER + "idle,0,10,1,1,1,1\n"));

        assertThat(services.get(0).toReplicas()).isEmpty();
    }

    @Test
    void testMissingColumnIsReported() {
        String csv = "Servicios,Cantidad,USO CPU (%)\napi,1,50\n";

        assertThatThrownBy(() -> loader.load(new StringReader(csv)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Row 2")
            .hasMessageContaining("missing column");
    }

    @Test
    void testNonNumericValueIsReported() {
        assertThatThrownBy(() -> loader.load(new StringReader(HEADER + "api,1,lots,1,1,1,1\n")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("USO CPU (%)")
            .hasMessageContaining("is not a number");
    }

    @Test
    void testFractionalQuantityIsRejected() {
        assertThatThrownBy(() -> loader.load(new StringReader(HEADER + "api,1.5,10,1,1,1,1\n")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("quantity must be a non-negative integer");
    }

    @Test
    void testUnboundedQuantityIsRejected() {
        assertThatThrownBy(() -> loader.load(new StringReader(HEADER + "api,Infinity,10,1,1,1,1\n")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Row 2")
            .hasMessageContaining("quantity must be a non-negative integer");
        assertThatThrownBy(() -> loader.load(new StringReader(HEADER + "api,3000000000,10,1,1,1,1\n")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("quantity must be a non-negative integer");
    }

    @Test
    void testBlankServiceNameIsRejected() {
        assertThatThrownBy(() -> loader.load(new StringReader(HEADER + " ,1,10,1,1,1,1\n")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("service name is empty");
    }
}
