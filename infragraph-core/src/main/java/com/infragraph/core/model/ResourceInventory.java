package com.infragraph.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The raw resource inventory produced by the upstream parser.
 *
 * <p>The interchange shape is {@code {file: [{type: {name: attributes}}]}}. Entries that do not
 * follow that shape are skipped.
 *
 * @param resources resource declarations in declaration order
 */
public record ResourceInventory(
    List<ResourceRecord> resources
) {
    /**
     * Compact constructor with validation.
     */
    public ResourceInventory {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    /**
     * Creates an empty inventory.
     *
     * @return inventory without resources
     */
    public static ResourceInventory empty() {
        return new ResourceInventory(List.of());
    }

    /**
     * Builds an inventory from the {@code all_resource} interchange map.
     *
     * @param allResource map from source file to a list of {@code {type: {name: attributes}}} blocks
     * @return parsed inventory
     */
    @SuppressWarnings("unchecked")
    public static ResourceInventory fromAllResource(Map<String, List<Map<String, Object>>> allResource) {
        List<ResourceRecord> records = new ArrayList<>();
        if (allResource == null) {
            return new ResourceInventory(records);
        }
        for (Map.Entry<String, List<Map<String, Object>>> file : allResource.entrySet()) {
            if (file.getValue() == null) {
                continue;
            }
            for (Map<String, Object> block : file.getValue()) {
                if (block == null) {
                    continue;
                }
                for (Map.Entry<String, Object> typeEntry : block.entrySet()) {
                    if (!(typeEntry.getValue() instanceof Map<?, ?> instances)) {
                        continue;
                    }
                    for (Map.Entry<?, ?> instance : instances.entrySet()) {
                        Map<String, Object> attributes = instance.getValue() instanceof Map<?, ?> attrs
                            ? new LinkedHashMap<>((Map<String, Object>) attrs)
                            : Map.of();
                        records.add(new ResourceRecord(typeEntry.getKey(),
                            String.valueOf(instance.getKey()), file.getKey(), attributes));
                    }
                }
            }
        }
        return new ResourceInventory(records);
    }

    /**
     * Returns all declarations of the given type.
     *
     * @param type resource type
     * @return matching records
     */
    public List<ResourceRecord> ofType(String type) {
        return resources.stream()
            .filter(r -> Objects.equals(r.type(), type))
            .toList();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }

    public int size() {
        return resources.size();
    }
}
