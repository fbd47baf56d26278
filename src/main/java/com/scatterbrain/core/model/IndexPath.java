package com.scatterbrain.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Position of a task in a plan's tree: one child offset per level, starting at the root.
 * <p>
 * {@code [1,2,0]} selects the root's second child, that task's third child, and then its
 * first child. The empty path denotes the plan root. Paths are resolved against the live
 * tree on every lookup, so a path taken before a sibling was removed may now point
 * somewhere else.
 * <p>
 * Textual form is {@code "1,2,0"}; the root is {@code "root"} (an empty string also parses
 * to the root). In JSON a path is an array of integers.
 */
public final class IndexPath implements Serializable {

    public static final IndexPath ROOT = new IndexPath(List.of());

    private static final String ROOT_TEXT = "root";

    private final List<Integer> segments;

    private IndexPath(List<Integer> segments) {
        this.segments = segments;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static IndexPath of(List<Integer> segments) {
        if (segments == null || segments.isEmpty()) {
            return ROOT;
        }
        List<Integer> copy = new ArrayList<>(segments.size());
        for (Integer segment : segments) {
            if (segment == null || segment < 0) {
                throw new IllegalArgumentException("Index path segments must be non-negative: " + segments);
            }
            copy.add(segment);
        }
        return new IndexPath(Collections.unmodifiableList(copy));
    }

    public static IndexPath of(int... segments) {
        List<Integer> list = new ArrayList<>(segments.length);
        for (int segment : segments) {
            list.add(segment);
        }
        return of(list);
    }

    /**
     * Parses the comma-separated form, e.g. {@code "0,1,2"}. Whitespace around parts is ignored.
     *
     * @throws IllegalArgumentException if a part is not a non-negative integer
     */
    public static IndexPath parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Index path is required");
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || ROOT_TEXT.equalsIgnoreCase(trimmed)) {
            return ROOT;
        }
        String[] parts = trimmed.split(",", -1);
        List<Integer> segments = new ArrayList<>(parts.length);
        for (String part : parts) {
            String p = part.trim();
            if (p.isEmpty() || !p.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Invalid index path '" + text
                        + "': expected comma-separated non-negative integers such as 0,1,2");
            }
            try {
                segments.add(Integer.parseInt(p));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Index path segment out of range in '" + text + "'", e);
            }
        }
        return of(segments);
    }

    /** Lets Spring bind {@code @PathVariable IndexPath} and picocli converters reuse the parser. */
    public static IndexPath valueOf(String text) {
        return parse(text);
    }

    @JsonValue
    public List<Integer> segments() {
        return segments;
    }

    public int depth() {
        return segments.size();
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int get(int level) {
        return segments.get(level);
    }

    public int last() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no last segment");
        }
        return segments.get(segments.size() - 1);
    }

    public IndexPath child(int offset) {
        List<Integer> next = new ArrayList<>(segments);
        next.add(offset);
        return of(next);
    }

    public IndexPath parent() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no parent");
        }
        return of(segments.subList(0, segments.size() - 1));
    }

    /**
     * True if this path equals {@code prefix} or lies inside the subtree it denotes.
     */
    public boolean startsWith(IndexPath prefix) {
        if (prefix.depth() > depth()) {
            return false;
        }
        return segments.subList(0, prefix.depth()).equals(prefix.segments);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexPath other)) return false;
        return segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return ROOT_TEXT;
        }
        return segments.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
