package com.scatterbrain.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scatterbrain.core.model.CurrentTask;
import com.scatterbrain.core.model.DistilledContext;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Lease;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.PlanSummary;
import com.scatterbrain.core.model.Task;
import com.scatterbrain.core.plan.ErrorKind;
import com.scatterbrain.core.plan.PlanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * HTTP client for the plan REST API.
 *
 * <p>Error responses carry the error kind, which is turned back into a {@link PlanException}
 * of the same kind. Anything else that goes wrong on the wire surfaces as an
 * {@link ApiClientException}.
 */
public class PlanApiClient {

    private static final Logger log = LoggerFactory.getLogger(PlanApiClient.class);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PlanApiClient(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public String baseUrl() {
        return baseUrl;
    }

    // --- Plans ---

    public long createPlan(String goal, String notes) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("goal", goal);
        body.put("notes", notes);
        return send("POST", "/plans", body).get("plan_id").asLong();
    }

    public List<PlanSummary> listPlans() {
        return convert(send("GET", "/plans", null), new TypeReference<>() {});
    }

    public Plan getPlan(long planId) {
        return convert(send("GET", plan(planId), null), Plan.class);
    }

    public void deletePlan(long planId) {
        send("DELETE", plan(planId), null);
    }

    // --- Tasks ---

    /**
     * @param parent null to add under the task in focus
     */
    public IndexPath addTask(long planId, IndexPath parent, String description, Level level, String notes) {
        ObjectNode body = objectMapper.createObjectNode();
        if (parent != null) {
            body.set("parent", objectMapper.valueToTree(parent));
        }
        body.put("description", description);
        body.put("level", level.name());
        body.put("notes", notes);
        return convert(send("POST", plan(planId) + "/tasks", body).get("path"), IndexPath.class);
    }

    public Task removeTask(long planId, IndexPath path) {
        return convert(send("DELETE", task(planId, path), null), Task.class);
    }

    public Lease generateLease(long planId, IndexPath path) {
        return convert(send("POST", task(planId, path) + "/lease", null), Lease.class);
    }

    public void completeTask(long planId, IndexPath path, Long lease, boolean force, String summary) {
        ObjectNode body = objectMapper.createObjectNode();
        if (lease != null) {
            body.put("lease", lease);
        }
        body.put("force", force);
        body.put("summary", summary);
        send("POST", task(planId, path) + "/complete", body);
    }

    public void uncompleteTask(long planId, IndexPath path) {
        send("POST", task(planId, path) + "/uncomplete", null);
    }

    public void changeLevel(long planId, IndexPath path, Level level) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("level", level.name());
        send("PUT", task(planId, path) + "/level", body);
    }

    // --- Notes ---

    public Optional<String> getNotes(long planId, IndexPath path) {
        JsonNode notes = send("GET", task(planId, path) + "/notes", null).get("notes");
        return notes == null || notes.isNull() ? Optional.empty() : Optional.of(notes.asText());
    }

    public void setNotes(long planId, IndexPath path, String notes) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("notes", notes);
        send("PUT", task(planId, path) + "/notes", body);
    }

    public void deleteNotes(long planId, IndexPath path) {
        send("DELETE", task(planId, path) + "/notes", null);
    }

    // --- Focus ---

    public CurrentTask moveTo(long planId, IndexPath path) {
        ObjectNode body = objectMapper.createObjectNode();
        body.set("path", objectMapper.valueToTree(path));
        return convert(send("POST", plan(planId) + "/move", body), CurrentTask.class);
    }

    public CurrentTask getCurrent(long planId) {
        return convert(send("GET", plan(planId) + "/current", null), CurrentTask.class);
    }

    public DistilledContext getDistilledContext(long planId) {
        return convert(send("GET", plan(planId) + "/distilled", null), DistilledContext.class);
    }

    // --- Events ---

    /**
     * Streams the plan's change events until the server ends the stream. Comment lines
     * (connection confirmation, heartbeats) are skipped.
     *
     * @param onEvent receives the event name and its JSON data
     */
    public void streamEvents(long planId, BiConsumer<String, String> onEvent) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/v1" + plan(planId) + "/events"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();

        HttpResponse<Stream<String>> response = execute(request, HttpResponse.BodyHandlers.ofLines());
        if (response.statusCode() != 200) {
            String body = String.join("\n", response.body().toList());
            throw errorFrom(response.statusCode(), body);
        }

        // Parse SSE stream
        final String[] currentEventType = {""};
        try (Stream<String> lines = response.body()) {
            lines.forEach(line -> {
                if (line.startsWith("event:")) {
                    currentEventType[0] = line.substring(6).trim();
                } else if (line.startsWith("data:")) {
                    String data = line.substring(5).trim();
                    String eventType = currentEventType[0].isEmpty() ? "message" : currentEventType[0];
                    onEvent.accept(eventType, data);
                    currentEventType[0] = "";
                }
            });
        }
    }

    // --- HTTP plumbing ---

    private static String plan(long planId) {
        return "/plans/" + planId;
    }

    private static String task(long planId, IndexPath path) {
        return plan(planId) + "/tasks/" + path;
    }

    private JsonNode send(String method, String path, JsonNode body) {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body.toString());
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/api/v1" + path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(30))
                .method(method, publisher)
                .build();

        log.debug("{} {}", method, request.uri());
        HttpResponse<String> response = execute(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() >= 300) {
            throw errorFrom(response.statusCode(), response.body());
        }
        if (response.body() == null || response.body().isBlank()) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ApiClientException("Unreadable response from " + request.uri() + ": " + e.getOriginalMessage(), e);
        }
    }

    private <T> HttpResponse<T> execute(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (ConnectException e) {
            throw new ApiClientException("Cannot connect to Scatterbrain server at " + baseUrl, e);
        } catch (IOException e) {
            throw new ApiClientException("Request to " + request.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiClientException("Interrupted while calling " + request.uri(), e);
        }
    }

    /**
     * Rebuilds the typed error from a {@code {"kind": ..., "error": ...}} body.
     */
    RuntimeException errorFrom(int status, String body) {
        try {
            JsonNode node = objectMapper.readTree(body == null ? "" : body);
            if (node != null && node.hasNonNull("kind")) {
                ErrorKind kind = ErrorKind.valueOf(node.get("kind").asText());
                String message = node.hasNonNull("error") ? node.get("error").asText() : kind.name();
                return new PlanException(kind, message);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Error body of HTTP {} is not a plan error: {}", status, e.getMessage());
        }
        return new ApiClientException("Server returned HTTP " + status);
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        return objectMapper.convertValue(node, type);
    }

    private <T> T convert(JsonNode node, TypeReference<T> type) {
        return objectMapper.convertValue(node, type);
    }
}
