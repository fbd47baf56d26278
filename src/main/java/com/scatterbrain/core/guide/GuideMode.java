package com.scatterbrain.core.guide;

import java.util.Locale;

/**
 * Which surface a guide is rendered for; the two differ only in how operations are named.
 */
public enum GuideMode {
    CLI,
    MCP;

    public static GuideMode parse(String text) {
        if (text == null || text.isBlank()) {
            return CLI;
        }
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown guide mode: " + text + " (expected cli or mcp)");
        }
    }
}
