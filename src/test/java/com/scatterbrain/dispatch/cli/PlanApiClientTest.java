package com.scatterbrain.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Lease;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.plan.ErrorKind;
import com.scatterbrain.core.plan.PlanException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanApiClientTest {

    private HttpClient httpClient;
    private PlanApiClient client;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
        client = new PlanApiClient("http://localhost:3000/", httpClient, new ObjectMapper());
    }

    @SuppressWarnings("unchecked")
    private <T> HttpResponse<T> response(int status, T body) {
        HttpResponse<T> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    private HttpRequest lastRequest() throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void trailingSlashIsDroppedFromBaseUrl() {
        assertEquals("http://localhost:3000", client.baseUrl());
    }

    @Test
    void createPlanPostsAndReturnsId() throws Exception {
        doReturn(response(201, "{\"plan_id\":7}")).when(httpClient).send(any(), any());

        assertEquals(7L, client.createPlan("Build an API", null));

        HttpRequest request = lastRequest();
        assertEquals("POST", request.method());
        assertEquals("http://localhost:3000/api/v1/plans", request.uri().toString());
    }

    @Test
    void addTaskReadsThePathArray() throws Exception {
        doReturn(response(201, "{\"path\":[0,1]}")).when(httpClient).send(any(), any());

        IndexPath path = client.addTask(3, IndexPath.of(0), "Define endpoints", Level.ISOLATION, null);

        assertEquals(IndexPath.of(0, 1), path);
        assertEquals("http://localhost:3000/api/v1/plans/3/tasks", lastRequest().uri().toString());
    }

    @Test
    void taskPathsUseTheCommaForm() throws Exception {
        doReturn(response(200, "")).when(httpClient).send(any(), any());

        client.uncompleteTask(3, IndexPath.of(0, 2));

        assertEquals("http://localhost:3000/api/v1/plans/3/tasks/0,2/uncomplete", lastRequest().uri().toString());
    }

    @Test
    void leaseResponseIsConverted() throws Exception {
        doReturn(response(200, "{\"planId\":3,\"path\":[],\"token\":12,"
                + "\"verificationSuggestions\":[\"Ensure all tests pass.\"]}"))
                .when(httpClient).send(any(), any());

        Lease lease = client.generateLease(3, IndexPath.ROOT);

        assertEquals(12L, lease.token());
        assertTrue(lease.path().isRoot());
        assertEquals(List.of("Ensure all tests pass."), lease.verificationSuggestions());
    }

    @Test
    void nullNotesAreEmpty() throws Exception {
        doReturn(response(200, "{\"notes\":null}")).when(httpClient).send(any(), any());
        assertEquals(Optional.empty(), client.getNotes(3, IndexPath.of(0)));
    }

    @Test
    void errorBodyBecomesPlanExceptionOfTheSameKind() throws Exception {
        doReturn(response(409, "{\"kind\":\"LEASE_INVALID\",\"error\":\"Lease 4 is not valid\"}"))
                .when(httpClient).send(any(), any());

        PlanException e = assertThrows(PlanException.class,
                () -> client.completeTask(3, IndexPath.of(0), 4L, false, null));
        assertEquals(ErrorKind.LEASE_INVALID, e.kind());
        assertEquals("Lease 4 is not valid", e.getMessage());
    }

    @Test
    void unknownErrorBodyIsATransportFailure() {
        RuntimeException e = client.errorFrom(502, "<html>Bad Gateway</html>");
        assertInstanceOf(ApiClientException.class, e);
        assertTrue(e.getMessage().contains("502"));
    }

    @Test
    void unknownKindIsATransportFailure() {
        assertInstanceOf(ApiClientException.class, client.errorFrom(400, "{\"kind\":\"TEAPOT\"}"));
    }

    @Test
    void connectionRefusedIsReported() throws Exception {
        doThrow(new ConnectException("refused")).when(httpClient).send(any(), any());

        ApiClientException e = assertThrows(ApiClientException.class, client::listPlans);
        assertTrue(e.getMessage().contains("Cannot connect to Scatterbrain server at http://localhost:3000"));
    }

    @Test
    void eventStreamSkipsCommentsAndPairsNamesWithData() throws Exception {
        Stream<String> lines = Stream.of(
                ": connected",
                "event:task.added",
                "data:{\"path\":[0]}",
                "",
                ": heartbeat",
                "data:{\"plain\":true}");
        doReturn(response(200, lines)).when(httpClient).send(any(), any());

        List<String> received = new ArrayList<>();
        client.streamEvents(3, (type, data) -> received.add(type + " " + data));

        assertEquals(List.of("task.added {\"path\":[0]}", "message {\"plain\":true}"), received);
    }

    @Test
    void clientsFallBackToTheConfiguredServer() {
        CliProperties properties = new CliProperties();
        properties.setServer("http://planner:4000");
        PlanApiClients clients = new PlanApiClients(properties, new ObjectMapper());

        assertEquals("http://planner:4000", clients.connect(null).baseUrl());
        assertEquals("http://other:5000", clients.connect("http://other:5000").baseUrl());
    }
}
