package com.scatterbrain.mcp;

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
import com.scatterbrain.core.plan.ErrorKind;
import com.scatterbrain.core.plan.PlanException;
import com.scatterbrain.core.plan.PlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The plan operations as discrete tools for an automated caller.
 * <p>
 * Paths are strings ({@code "0,1"}, {@code "root"}); levels are 0-3 or a level name. Failures
 * are raised as {@link ToolCallException} with the error kind in brackets at the start of the
 * message.
 */
@Component
public class PlanTools {

    private static final Logger log = LoggerFactory.getLogger(PlanTools.class);

    private final PlanStore planStore;

    public PlanTools(PlanStore planStore) {
        this.planStore = planStore;
    }

    // --- Plans ---

    @Tool(name = "create_plan", description = "Create a new plan from a goal prompt. Returns the new plan id.")
    public Map<String, Long> createPlan(
            @ToolParam(description = "The high-level goal the plan is for") String prompt,
            @ToolParam(description = "Optional plan notes", required = false) String notes) {
        return call(() -> Map.of("plan_id", planStore.createPlan(prompt, notes)));
    }

    @Tool(name = "get_plan", description = "Get a plan by id, with its full task tree")
    public Plan getPlan(@ToolParam(description = "Plan id") long planId) {
        return call(() -> planStore.getPlan(planId));
    }

    @Tool(name = "list_plans", description = "List all plans with their goals")
    public List<PlanSummary> listPlans() {
        return call(planStore::listPlans);
    }

    @Tool(name = "delete_plan", description = "Delete a plan by id")
    public String deletePlan(@ToolParam(description = "Plan id") long planId) {
        return call(() -> {
            planStore.deletePlan(planId);
            return "Deleted plan " + planId;
        });
    }

    // --- Tasks ---

    @Tool(name = "add_task", description = "Add a task as the last child of the task in focus, or of 'parent' "
            + "when given. Returns the new task's path.")
    public Map<String, String> addTask(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task description") String description,
            @ToolParam(description = "Abstraction level: 0 planning, 1 isolation, 2 ordering, 3 implementation")
            String level,
            @ToolParam(description = "Optional task notes", required = false) String notes,
            @ToolParam(description = "Optional parent path such as \"0,1\" or \"root\"", required = false)
            String parent) {
        return call(() -> {
            IndexPath parentPath = parent == null || parent.isBlank() ? null : IndexPath.parse(parent);
            IndexPath path = planStore.addTask(planId, parentPath, description, Level.parse(level), notes);
            return Map.of("path", path.toString());
        });
    }

    @Tool(name = "complete_task", description = "Complete a task using a lease from generate_lease. "
            + "Completing a task also completes its subtasks. force=true skips the lease check and "
            + "should only be used to repair state.")
    public String completeTask(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path such as \"0,1\"; \"root\" completes the whole plan") String index,
            @ToolParam(description = "Lease token from generate_lease", required = false) Long lease,
            @ToolParam(description = "Complete without a lease", required = false) Boolean force,
            @ToolParam(description = "Short summary of what was done", required = false) String summary) {
        return call(() -> {
            IndexPath path = IndexPath.parse(index);
            planStore.completeTask(planId, path, lease, Boolean.TRUE.equals(force), summary);
            return "Completed task " + path;
        });
    }

    @Tool(name = "uncomplete_task", description = "Reopen a completed task")
    public String uncompleteTask(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path such as \"0,1\"") String index) {
        return call(() -> {
            IndexPath path = IndexPath.parse(index);
            planStore.uncompleteTask(planId, path);
            return "Reopened task " + path;
        });
    }

    @Tool(name = "remove_task", description = "Remove a task and its subtasks. Later siblings move up by one, "
            + "so re-read paths afterwards.")
    public Task removeTask(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path such as \"0,1\"") String index) {
        return call(() -> planStore.removeTask(planId, IndexPath.parse(index)));
    }

    @Tool(name = "change_level", description = "Change the abstraction level of a task")
    public String changeLevel(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path such as \"0,1\"") String index,
            @ToolParam(description = "New level: 0-3 or a level name") String level) {
        return call(() -> {
            Level newLevel = Level.parse(level);
            planStore.changeLevel(planId, IndexPath.parse(index), newLevel);
            return "Task " + index + " is now at level " + newLevel;
        });
    }

    // --- Navigation ---

    @Tool(name = "move_to", description = "Move the focus to a task by path (e.g. \"0,1,2\" or \"root\")")
    public CurrentTask moveTo(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path") String index) {
        return call(() -> {
            planStore.moveTo(planId, IndexPath.parse(index));
            return planStore.getCurrent(planId);
        });
    }

    @Tool(name = "get_current", description = "Get the task in focus with its level and ancestors")
    public CurrentTask getCurrent(@ToolParam(description = "Plan id") long planId) {
        return call(() -> planStore.getCurrent(planId));
    }

    @Tool(name = "get_distilled_context", description = "Get a compact view of the plan centred on the task "
            + "in focus: ancestors, subtasks, focused tree, levels and recent history")
    public DistilledContext getDistilledContext(@ToolParam(description = "Plan id") long planId) {
        return call(() -> planStore.distilledContext(planId));
    }

    // --- Notes ---

    @Tool(name = "get_task_notes", description = "Get the notes of a task; on \"root\" the plan notes")
    public Map<String, String> getTaskNotes(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path") String index) {
        return call(() -> {
            String notes = planStore.getNotes(planId, IndexPath.parse(index)).orElse("");
            return Map.of("notes", notes);
        });
    }

    @Tool(name = "set_task_notes", description = "Replace the notes of a task. Revokes the task's lease.")
    public String setTaskNotes(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path") String index,
            @ToolParam(description = "Notes text") String notes) {
        return call(() -> {
            planStore.setNotes(planId, IndexPath.parse(index), notes);
            return "Notes updated";
        });
    }

    @Tool(name = "delete_task_notes", description = "Delete the notes of a task. Revokes the task's lease.")
    public String deleteTaskNotes(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path") String index) {
        return call(() -> {
            planStore.deleteNotes(planId, IndexPath.parse(index));
            return "Notes deleted";
        });
    }

    // --- Leases and guide ---

    @Tool(name = "generate_lease", description = "Take a completion lease on an open task. Only the newest "
            + "lease is valid. A lease on \"root\" comes with checks to run before completing the plan.")
    public Lease generateLease(
            @ToolParam(description = "Plan id") long planId,
            @ToolParam(description = "Task path") String index) {
        return call(() -> planStore.generateLease(planId, IndexPath.parse(index)));
    }

    @Tool(name = "get_guide", description = "Get the guide to working with Scatterbrain through these tools")
    public String getGuide() {
        return Guide.render(GuideMode.MCP);
    }

    private <T> T call(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (PlanException e) {
            log.debug("Tool call failed: [{}] {}", e.kind(), e.getMessage());
            throw new ToolCallException("[" + e.kind() + "] " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            log.debug("Tool call rejected: {}", e.getMessage());
            throw new ToolCallException("[" + ErrorKind.INVALID_OPERATION + "] " + e.getMessage(), e);
        }
    }
}
