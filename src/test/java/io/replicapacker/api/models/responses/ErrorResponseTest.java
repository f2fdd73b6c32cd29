package io.replicapacker.api.models.responses;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ErrorResponse.
 */
class ErrorResponseTest {

    @Test
    void testPackingError() {
        ErrorResponse error = ErrorResponse.packingError("InvalidCapacityException", "Invalid CPU capacity -1.0");

        assertThat(error.getError()).isEqualTo("packing_exception");
        assertThat(error.getType()).isEqualTo("InvalidCapacityException");
        assertThat(error.getStatus()).isEqualTo(400);
    }

    @Test
    void testBadRequest() {
        ErrorResponse error = ErrorResponse.badRequest("Capacity is required");

        assertThat(error.getError()).isEqualTo("bad_request");
        assertThat(error.getType()).isNull();
        assertThat(error.getReason()).isEqualTo("Capacity is required");
        assertThat(error.getStatus()).isEqualTo(400);
    }

    @Test
    void testEmptyFieldsAreOmitted() throws Exception {
        String json = new ObjectMapper().writeValueAsString(ErrorResponse.internalError("boom"));

        assertThat(json).isEqualTo("{\"error\":\"internal_server_error\",\"reason\":\"boom\",\"status\":500}");
    }
}
