package io.replicapacker.config;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;
import static io.replicapacker.config.Constants.*;

/**
 * Tests for Constants.
 */
class ConstantsTest {
    
    @Test
    void testDefaultConfigurationConstants() {
        assertThat(DEFAULT_PACKER_ID).isEqualTo("replica-packer");
        assertThat(DEFAULT_SEARCH_STRATEGY).isEqualTo(SEARCH_STRATEGY_RANDOM);
        assertThat(DEFAULT_SAMPLE_BUDGET).isEqualTo(100);
        assertThat(DEFAULT_SEED).isEqualTo(1L);
        assertThat(DEFAULT_MAX_TRIALS).isEqualTo(121);
        assertThat(DEFAULT_OUTPUT_FILE).isEqualTo("plan_asignacion.json");
    }
    
    @Test
    void testCsvColumnConstants() {
        assertThat(CSV_COLUMN_SERVICE).isEqualTo("Servicios");
        assertThat(CSV_COLUMN_QUANTITY).isEqualTo("Cantidad");
        assertThat(CSV_COLUMN_CPU_PERCENT).isEqualTo("USO CPU (%)");
        assertThat(CSV_COLUMN_MEMORY).isEqualTo("Memoria (GB)");
    }
    
    @Test
    void testOptionConstants() {
        assertThat(OPTION_CSV).isEqualTo("csv");
        assertThat(OPTION_DISK_IO).isEqualTo("disk-io");
        assertThat(OPTION_SAMPLE_BUDGET).isEqualTo("sample-budget");
    }
}
