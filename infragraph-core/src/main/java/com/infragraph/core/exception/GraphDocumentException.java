package com.infragraph.core.exception;

import java.util.Map;

/**
 * Raised when an interchange document cannot be read or written.
 */
public class GraphDocumentException extends InfraGraphException {

    public GraphDocumentException(String message, String location, Throwable cause) {
        super(message, Map.of("location", location), cause);
    }
}
