package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.Level;
import picocli.CommandLine;

/**
 * Accepts a level ordinal (0-3) or a level name in any case.
 */
public class LevelConverter implements CommandLine.ITypeConverter<Level> {

    @Override
    public Level convert(String value) {
        try {
            return Level.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
