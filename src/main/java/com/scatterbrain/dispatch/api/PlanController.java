package com.scatterbrain.dispatch.api;

import com.scatterbrain.core.guide.Guide;
import com.scatterbrain.core.guide.GuideMode;
import com.scatterbrain.core.model.CurrentTask;
import com.scatterbrain.core.model.DistilledContext;
import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Lease;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.model.Plan;
import com.scatterbrain.core.model.PlanSummary;
import com.scatterbrain.core.model.Task;
import com.scatterbrain.core.plan.PlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * REST controller for plans, tasks, focus, notes and leases.
 * <p>
 * Task paths appear in URLs in their textual form ({@code 0,1,2} or {@code root}).
 */
@RestController
@RequestMapping("/api/v1")
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    private final PlanStore planStore;
    private final SseStreamingService sseStreamingService;

    public PlanController(PlanStore planStore, SseStreamingService sseStreamingService) {
        this.planStore = planStore;
        this.sseStreamingService = sseStreamingService;
    }

    // --- Plans ---

    /**
     * POST /api/v1/plans: Create a plan.
     */
    @PostMapping("/plans")
    public ResponseEntity<PlanResponses.PlanCreated> createPlan(@RequestBody PlanRequests.CreatePlan request) {
        long planId = planStore.createPlan(request.goal(), request.notes());
        return ResponseEntity.status(HttpStatus.CREATED).body(new PlanResponses.PlanCreated(planId));
    }

    /**
     * GET /api/v1/plans: List plans.
     */
    @GetMapping("/plans")
    public List<PlanSummary> listPlans() {
        return planStore.listPlans();
    }

    /**
     * GET /api/v1/plans/{id}: Full plan snapshot.
     */
    @GetMapping("/plans/{id}")
    public Plan getPlan(@PathVariable long id) {
        return planStore.getPlan(id);
    }

    /**
     * DELETE /api/v1/plans/{id}
     */
    @DeleteMapping("/plans/{id}")
    public ResponseEntity<Void> deletePlan(@PathVariable long id) {
        planStore.deletePlan(id);
        return ResponseEntity.noContent().build();
    }

    // --- Focus and views ---

    @GetMapping("/plans/{id}/current")
    public CurrentTask getCurrent(@PathVariable long id) {
        return planStore.getCurrent(id);
    }

    @PostMapping("/plans/{id}/move")
    public CurrentTask move(@PathVariable long id, @RequestBody PlanRequests.Move request) {
        IndexPath path = request.path() != null ? request.path() : IndexPath.ROOT;
        planStore.moveTo(id, path);
        return planStore.getCurrent(id);
    }

    @GetMapping("/plans/{id}/distilled")
    public DistilledContext getDistilledContext(@PathVariable long id) {
        return planStore.distilledContext(id);
    }

    // --- Tasks ---

    /**
     * POST /api/v1/plans/{id}/tasks: Add a task. Without a parent it goes under the task in focus.
     */
    @PostMapping("/plans/{id}/tasks")
    public ResponseEntity<PlanResponses.TaskAdded> addTask(@PathVariable long id,
                                                           @RequestBody PlanRequests.AddTask request) {
        Level level = Level.parse(request.level());
        IndexPath path = planStore.addTask(id, request.parent(), request.description(), level, request.notes());
        return ResponseEntity.status(HttpStatus.CREATED).body(new PlanResponses.TaskAdded(path));
    }

    @DeleteMapping("/plans/{id}/tasks/{path}")
    public Task removeTask(@PathVariable long id, @PathVariable IndexPath path) {
        return planStore.removeTask(id, path);
    }

    @PostMapping("/plans/{id}/tasks/{path}/lease")
    public Lease generateLease(@PathVariable long id, @PathVariable IndexPath path) {
        return planStore.generateLease(id, path);
    }

    /**
     * POST /api/v1/plans/{id}/tasks/{path}/complete: Complete with a lease, or with force.
     */
    @PostMapping("/plans/{id}/tasks/{path}/complete")
    public ResponseEntity<Void> completeTask(@PathVariable long id, @PathVariable IndexPath path,
                                             @RequestBody(required = false) PlanRequests.CompleteTask request) {
        PlanRequests.CompleteTask body = request != null ? request : new PlanRequests.CompleteTask(null, null, null);
        boolean force = Boolean.TRUE.equals(body.force());
        if (force) {
            log.info("Forced completion requested for {} in plan {}", path, id);
        }
        planStore.completeTask(id, path, body.lease(), force, body.summary());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/plans/{id}/tasks/{path}/uncomplete")
    public ResponseEntity<Void> uncompleteTask(@PathVariable long id, @PathVariable IndexPath path) {
        planStore.uncompleteTask(id, path);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/plans/{id}/tasks/{path}/level")
    public ResponseEntity<Void> changeLevel(@PathVariable long id, @PathVariable IndexPath path,
                                            @RequestBody PlanRequests.ChangeLevel request) {
        planStore.changeLevel(id, path, Level.parse(request.level()));
        return ResponseEntity.noContent().build();
    }

    // --- Notes ---

    @GetMapping("/plans/{id}/tasks/{path}/notes")
    public PlanResponses.Notes getNotes(@PathVariable long id, @PathVariable IndexPath path) {
        return new PlanResponses.Notes(path, planStore.getNotes(id, path).orElse(null));
    }

    @PutMapping("/plans/{id}/tasks/{path}/notes")
    public ResponseEntity<Void> setNotes(@PathVariable long id, @PathVariable IndexPath path,
                                         @RequestBody PlanRequests.SetNotes request) {
        planStore.setNotes(id, path, request.notes());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/plans/{id}/tasks/{path}/notes")
    public ResponseEntity<Void> deleteNotes(@PathVariable long id, @PathVariable IndexPath path) {
        planStore.deleteNotes(id, path);
        return ResponseEntity.noContent().build();
    }

    // --- Events and guide ---

    /**
     * GET /api/v1/plans/{id}/events: SSE stream of change events for a plan.
     */
    @GetMapping(value = "/plans/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable long id) {
        planStore.getPlan(id);
        return sseStreamingService.createEmitter(id);
    }

    @GetMapping(value = "/guide", produces = MediaType.TEXT_PLAIN_VALUE)
    public String guide(@RequestParam(defaultValue = "cli") String mode) {
        return Guide.render(GuideMode.parse(mode));
    }
}
