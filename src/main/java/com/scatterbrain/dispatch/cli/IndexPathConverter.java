package com.scatterbrain.dispatch.cli;

import com.scatterbrain.core.model.IndexPath;
import picocli.CommandLine;

/**
 * Parses {@code 0,1,2} or {@code root} into an {@link IndexPath}.
 */
public class IndexPathConverter implements CommandLine.ITypeConverter<IndexPath> {

    @Override
    public IndexPath convert(String value) {
        try {
            return IndexPath.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
