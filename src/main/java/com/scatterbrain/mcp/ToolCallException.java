package com.scatterbrain.mcp;

/**
 * Failure of a tool call. The message starts with the error kind in brackets so the calling
 * agent can tell a stale lease from a missing task.
 */
public class ToolCallException extends RuntimeException {

    public ToolCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
