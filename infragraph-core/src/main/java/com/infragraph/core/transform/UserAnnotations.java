package com.infragraph.core.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hand-written edits applied to the graph after the automatic annotations.
 *
 * <p>A key containing {@code *} in {@code connect}, {@code disconnect}, {@code remove} and
 * {@code update} selects every node whose id, without its module path, starts with the text
 * before the {@code *}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * annotations:
 *   title: "Checkout"
 *   add:
 *     aws_sqs_queue.jobs: { label: "Jobs" }
 *   connect:
 *     aws_lambda_function*:
 *       - aws_sqs_queue.jobs
 *       - aws_s3_bucket.data: "writes"
 *   disconnect:
 *     aws_instance.web: [ aws_cloudwatch_log_group.web ]
 *   remove:
 *     - aws_iam_role*
 *   update:
 *     aws_instance.web: { label: "Web tier" }
 * }</pre>
 *
 * @param title diagram title, or null
 * @param add nodes to create, with their metadata
 * @param connect connections to add per origin; an entry is a destination id or a single
 *                {@code destination: label} pair
 * @param disconnect connections to drop per origin
 * @param remove nodes to delete
 * @param update metadata attributes to set per node
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserAnnotations(
    @JsonProperty("title") String title,
    @JsonProperty("add") Map<String, Map<String, Object>> add,
    @JsonProperty("connect") Map<String, List<Object>> connect,
    @JsonProperty("disconnect") Map<String, List<String>> disconnect,
    @JsonProperty("remove") List<String> remove,
    @JsonProperty("update") Map<String, Map<String, Object>> update
) {
    public UserAnnotations {
        title = title == null || title.isBlank() ? null : title;
        add = copy(add);
        connect = copy(connect);
        disconnect = copy(disconnect);
        remove = remove == null ? List.of() : List.copyOf(remove);
        update = copy(update);
    }

    /**
     * Returns annotations that change nothing.
     *
     * @return empty annotations
     */
    public static UserAnnotations none() {
        return new UserAnnotations(null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return add.isEmpty() && connect.isEmpty() && disconnect.isEmpty() && remove.isEmpty() && update.isEmpty();
    }

    private static <V> Map<String, V> copy(Map<String, V> map) {
        if (map == null) {
            return Map.of();
        }
        // Null values (a YAML key with no body) are dropped; insertion order is kept.
        Map<String, V> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
