package com.scatterbrain.dispatch.cli;

/**
 * The server could not be reached or answered with something other than a plan error.
 */
public class ApiClientException extends RuntimeException {

    public ApiClientException(String message) {
        super(message);
    }

    public ApiClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
