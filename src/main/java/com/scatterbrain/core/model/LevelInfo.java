package com.scatterbrain.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Serializable description of a {@link Level}, for views that list the available levels.
 */
public record LevelInfo(
    int index,
    Level level,
    String description,
    String focus,
    List<String> questions
) implements Serializable {

    public static LevelInfo of(Level level) {
        return new LevelInfo(level.ordinal(), level, level.description(), level.focus(), level.questions());
    }
}
