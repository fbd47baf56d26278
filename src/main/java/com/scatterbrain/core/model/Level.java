package com.scatterbrain.core.model;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Abstraction level a task is planned at, ordered from the most abstract
 * ({@link #PLANNING}) to the most concrete ({@link #IMPLEMENTATION}).
 * <p>
 * The label is advisory: a child may carry any level regardless of its parent.
 */
public enum Level {

    PLANNING(
            "High-level planning: architecture, scope and approach",
            "Stay at the level of whole systems. Leave implementation details out and reason about "
                    + "how components interact rather than how they work inside.",
            List.of(
                    "Is this approach simple?",
                    "Is this approach extensible?",
                    "Does it give good abstractions that leak as little as possible?")),

    ISOLATION(
            "Isolation: discrete parts that can be completed independently",
            "Concentrate on boundaries and interfaces. Give each part clear inputs and outputs and "
                    + "keep dependencies between parts explicit.",
            List.of(
                    "Can each part be completed and verified on its own?",
                    "Are the boundaries between parts modular and extensible?")),

    ORDERING(
            "Ordering: sequencing the parts of the plan",
            "Think about build order and critical paths. Identify which parts unblock others "
                    + "without descending into implementation.",
            List.of(
                    "Do we move from foundational building blocks to more complex pieces?",
                    "Does the order follow idiomatic design patterns?")),

    IMPLEMENTATION(
            "Implementation: turning each part into concrete tasks",
            "Name the specific changes or artifacts to produce. Refer back to higher levels when "
                    + "needed, and cover error cases and edge conditions.",
            List.of(
                    "Can each task be completed independently?",
                    "Does each task build on the ones before it?",
                    "Does each task lower the execution risk of the others?"));

    private final String description;
    private final String focus;
    private final List<String> questions;

    Level(String description, String focus, List<String> questions) {
        this.description = description;
        this.focus = focus;
        this.questions = questions;
    }

    public String description() {
        return description;
    }

    public String focus() {
        return focus;
    }

    public List<String> questions() {
        return questions;
    }

    /**
     * Renders the level's focus instruction and review questions as a block of text
     * suitable for showing to whoever is working at this level.
     */
    public String guidance() {
        return "Abstraction level: " + description + "\n\n"
                + "Focus: " + focus + "\n\n"
                + "Questions to consider:\n"
                + questions.stream().map(q -> "- " + q).collect(Collectors.joining("\n"));
    }

    public static Level fromIndex(int index) {
        Level[] values = values();
        if (index < 0 || index >= values.length) {
            throw new IllegalArgumentException(
                    "Level index " + index + " is out of range (0-" + (values.length - 1) + ")");
        }
        return values[index];
    }

    /**
     * Parses a level from its ordinal ("2") or its name ("ordering", case-insensitive).
     */
    public static Level parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Level is required");
        }
        String trimmed = text.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return fromIndex(Integer.parseInt(trimmed));
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown level: " + text);
        }
    }
}
