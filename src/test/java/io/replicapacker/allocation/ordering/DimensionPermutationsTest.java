package io.replicapacker.allocation.ordering;

import io.replicapacker.enums.ResourceDimension;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static io.replicapacker.enums.ResourceDimension.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for DimensionPermutations.
 */
class DimensionPermutationsTest {

    @Test
    void testCoversEveryOrderingOnce() {
        List<List<ResourceDimension>> all = DimensionPermutations.all();

        assertThat(DimensionPermutations.count()).isEqualTo(120);
        assertThat(all).hasSize(120);
        assertThat(new HashSet<>(all)).hasSize(120);
        assertThat(all).allSatisfy(ordering -> assertThat(ordering).containsExactlyInAnyOrder(ResourceDimension.values()));
    }

    @Test
    void testLexicographicOrder() {
        List<List<ResourceDimension>> all = DimensionPermutations.all();

        assertThat(all.get(0)).containsExactly(CPU, MEMORY, NETWORK, DISK_IO, STORAGE);
        assertThat(all.get(119)).containsExactly(STORAGE, DISK_IO, NETWORK, MEMORY, CPU);
    }

    @Test
    void testOrderingsAreImmutable() {
        assertThatThrownBy(() -> DimensionPermutations.all().get(0).set(0, STORAGE))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
