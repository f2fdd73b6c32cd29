package io.replicapacker.api.handlers;

import io.replicapacker.allocation.SearchResult;
import io.replicapacker.allocation.UnplaceableReplicaException;
import io.replicapacker.api.models.ResourceFields;
import io.replicapacker.api.models.requests.PlanRequest;
import io.replicapacker.api.models.requests.ServiceRequest;
import io.replicapacker.api.models.responses.ErrorResponse;
import io.replicapacker.api.models.responses.PlanResponse;
import io.replicapacker.enums.ResourceDimension;
import io.replicapacker.models.Plan;
import io.replicapacker.models.Replica;
import io.replicapacker.models.ResourceVector;
import io.replicapacker.models.Server;
import io.replicapacker.planning.PlanManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PlanHandlerTest {

    private static final ResourceVector CAPACITY = ResourceVector.of(2, 4, 100, 50, 200);

    @Mock
    private PlanManager planManager;

    @InjectMocks
    private PlanHandler planHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testCreatePlan_Success() throws Exception {
        // Given
        Replica replica = new Replica("svcA", ResourceVector.of(1, 2, 50, 10, 50));
        Plan plan = new Plan(List.of(Server.open("S1", replica)), CAPACITY, List.of(ResourceDimension.CPU));
        when(planManager.createPlan(any(), any(), any(), any()))
            .thenReturn(new SearchResult(plan, List.of(ResourceDimension.CPU), Map.of(), 1));

        // When
        ResponseEntity<Object> response = planHandler.createPlan(request(service("svcA", 2)));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(PlanResponse.from(plan));
    }

    @Test
    void testCreatePlan_ExpandsQuantityAndPassesOptions() throws Exception {
        // Given
        Plan plan = Plan.empty(CAPACITY, List.of(ResourceDimension.CPU));
        when(planManager.createPlan(any(), any(), any(), any()))
            .thenReturn(new SearchResult(plan, List.of(ResourceDimension.CPU), Map.of(), 0));
        PlanRequest request = request(service("svcA", 3), service("svcB", 1));
        request.setSeed(42L);
        request.setSampleBudget(10);

        // When
        planHandler.createPlan(request);

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Replica>> replicas = ArgumentCaptor.forClass(List.class);
        verify(planManager).createPlan(replicas.capture(), eq(CAPACITY), eq(42L), eq(10));
        assertThat(replicas.getValue()).extracting(Replica::getServiceName)
            .containsExactly("svcA", "svcA", "svcA", "svcB");
    }

    @Test
    void testCreatePlan_PackingFailure() throws Exception {
        // Given
        Replica replica = new Replica("svcA", ResourceVector.of(3, 1, 1, 1, 1));
        when(planManager.createPlan(any(), any(), any(), any()))
            .thenThrow(new UnplaceableReplicaException(replica, ResourceDimension.CPU, 2));

        // When
        ResponseEntity<Object> response = planHandler.createPlan(request(service("svcA", 1)));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo("packing_exception");
        assertThat(error.getType()).isEqualTo("UnplaceableReplicaException");
        assertThat(error.getReason()).contains("svcA").contains("CPU");
    }

    @Test
    void testCreatePlan_MissingCapacity() throws Exception {
        PlanRequest request = request(service("svcA", 1));
        request.setCapacity(null);

        ResponseEntity<Object> response = planHandler.createPlan(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).getReason()).isEqualTo("Capacity is required");
        verify(planManager, never()).createPlan(any(), any(), any(), any());
    }

    @Test
    void testCreatePlan_NegativeDemandIsBadRequest() throws Exception {
        ServiceRequest bad = new ServiceRequest("svcA", 1, ResourceFields.builder().cpu(-1).build());

        ResponseEntity<Object> response = planHandler.createPlan(request(bad));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).getError()).isEqualTo("bad_request");
    }

    @Test
    void testCreatePlan_UnexpectedError() throws Exception {
        when(planManager.createPlan(any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        ResponseEntity<Object> response = planHandler.createPlan(request(service("svcA", 1)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(((ErrorResponse) response.getBody()).getReason()).isEqualTo("boom");
    }

    private static PlanRequest request(ServiceRequest... services) {
        return PlanRequest.builder()
            .capacity(ResourceFields.from(CAPACITY))
            .services(List.of(services))
            .build();
    }

    private static ServiceRequest service(String name, int quantity) {
        return new ServiceRequest(name, quantity, ResourceFields.from(ResourceVector.of(1, 2, 50, 10, 50)));
    }
}
