package com.infragraph.core.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Base type for all errors raised by the InfraGraph pipeline.
 *
 * <p>Carries an ordered context map (resource ids, handler names, counts) next to the
 * human-readable message. The context is appended to the formatted message:
 *
 * <pre>{@code
 * throw new MissingResourceException("No VPC found; cannot flatten VPC endpoints",
 *     Map.of("handler", "vpc-endpoints", "endpoint_count", 2));
 * // -> "No VPC found; cannot flatten VPC endpoints (context: handler=vpc-endpoints, endpoint_count=2)"
 * }</pre>
 */
public class InfraGraphException extends RuntimeException {

    private final String detail;
    private final Map<String, Object> context;

    public InfraGraphException(String message) {
        this(message, Map.of(), null);
    }

    public InfraGraphException(String message, Map<String, ?> context) {
        this(message, context, null);
    }

    public InfraGraphException(String message, Map<String, ?> context, Throwable cause) {
        super(format(message, context), cause);
        this.detail = message;
        this.context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * Returns the message without the context suffix.
     *
     * @return raw message
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Returns the context entries supplied when the error was raised.
     *
     * @return immutable, insertion-ordered context map
     */
    public Map<String, Object> getContext() {
        return context;
    }

    @Override
    public String toString() {
        return getMessage();
    }

    private static String format(String message, Map<String, ?> context) {
        if (context == null || context.isEmpty()) {
            return message;
        }
        String rendered = context.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining(", "));
        return message + " (context: " + rendered + ")";
    }
}
