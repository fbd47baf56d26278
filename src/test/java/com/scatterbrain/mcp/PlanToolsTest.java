package com.scatterbrain.mcp;

import com.scatterbrain.core.model.IndexPath;
import com.scatterbrain.core.model.Level;
import com.scatterbrain.core.plan.PlanException;
import com.scatterbrain.core.plan.PlanStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PlanToolsTest {

    private PlanStore planStore;
    private PlanTools tools;

    @BeforeEach
    void setUp() {
        planStore = mock(PlanStore.class);
        tools = new PlanTools(planStore);
    }

    @Test
    void registersEveryTool() {
        ToolCallbackProvider provider = new McpServerConfig().planToolCallbacks(tools);

        Set<String> names = Arrays.stream(provider.getToolCallbacks())
                .map(ToolCallback::getToolDefinition)
                .map(definition -> definition.name())
                .collect(Collectors.toSet());

        assertEquals(Set.of("create_plan", "get_plan", "list_plans", "delete_plan", "add_task", "complete_task",
                "uncomplete_task", "remove_task", "change_level", "move_to", "get_current",
                "get_distilled_context", "get_task_notes", "set_task_notes", "delete_task_notes",
                "generate_lease", "get_guide"), names);
    }

    @Test
    void createPlanReturnsTheId() {
        when(planStore.createPlan("Build an API", null)).thenReturn(4L);
        assertEquals(Map.of("plan_id", 4L), tools.createPlan("Build an API", null));
    }

    @Test
    void addTaskParsesLevelAndParent() {
        when(planStore.addTask(1, IndexPath.of(0), "Define endpoints", Level.ISOLATION, null))
                .thenReturn(IndexPath.of(0, 0));

        assertEquals(Map.of("path", "0,0"), tools.addTask(1, "Define endpoints", "1", null, "0"));
    }

    @Test
    void blankParentAddsUnderTheFocus() {
        when(planStore.addTask(1, null, "Design schema", Level.PLANNING, "notes")).thenReturn(IndexPath.of(2));

        assertEquals(Map.of("path", "2"), tools.addTask(1, "Design schema", "planning", "notes", " "));
    }

    @Test
    void planErrorsCarryTheirKind() {
        doThrow(PlanException.leaseInvalid(IndexPath.of(0), 9))
                .when(planStore).completeTask(1, IndexPath.of(0), 9L, false, null);

        ToolCallException e = assertThrows(ToolCallException.class,
                () -> tools.completeTask(1, "0", 9L, null, null));
        assertTrue(e.getMessage().startsWith("[LEASE_INVALID] "), e.getMessage());
    }

    @Test
    void malformedPathIsAnInvalidOperation() {
        ToolCallException e = assertThrows(ToolCallException.class, () -> tools.moveTo(1, "0,a"));
        assertTrue(e.getMessage().startsWith("[INVALID_OPERATION] "), e.getMessage());
        verify(planStore, never()).moveTo(anyLong(), any());
    }

    @Test
    void unknownLevelIsAnInvalidOperation() {
        ToolCallException e = assertThrows(ToolCallException.class,
                () -> tools.changeLevel(1, "0", "design"));
        assertTrue(e.getMessage().startsWith("[INVALID_OPERATION] Unknown level"), e.getMessage());
    }

    @Test
    void forceIsPassedThrough() {
        tools.completeTask(1, "root", null, Boolean.TRUE, "all done");
        verify(planStore).completeTask(1, IndexPath.ROOT, null, true, "all done");
    }

    @Test
    void missingNotesAreEmpty() {
        when(planStore.getNotes(1, IndexPath.of(0))).thenReturn(Optional.empty());
        assertEquals(Map.of("notes", ""), tools.getTaskNotes(1, "0"));
    }

    @Test
    void guideDescribesTheTools() {
        String guide = tools.getGuide();
        assertTrue(guide.contains("generate_lease"));
        assertTrue(guide.contains("complete_task"));
    }
}
