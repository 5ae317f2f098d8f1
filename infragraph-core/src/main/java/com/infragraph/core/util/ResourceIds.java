package com.infragraph.core.util;

import java.util.Collection;
import java.util.Optional;

/**
 * Utilities for working with resource identifiers.
 *
 * <p>A resource identifier has the shape {@code type.name}, optionally prefixed with a
 * module path ({@code module.vpc.aws_subnet.private}) and optionally suffixed with a
 * synthetic instance number ({@code aws_subnet.private~2}). Identifiers are otherwise
 * opaque keys.
 */
public final class ResourceIds {

    /** Separator between a base identifier and its synthetic instance number. */
    public static final String NUMBER_SEPARATOR = "~";

    private static final String MODULE_MARKER = "module.";

    private ResourceIds() {
        // utility
    }

    /**
     * Removes the module path, keeping the last two dot-separated segments.
     *
     * @param id resource identifier
     * @return identifier without module path
     */
    public static String stripModule(String id) {
        if (id == null || !id.contains(MODULE_MARKER)) {
            return id;
        }
        String[] parts = id.split("\\.");
        if (parts.length < 2) {
            return id;
        }
        return parts[parts.length - 2] + "." + parts[parts.length - 1];
    }

    /**
     * Returns the resource type ({@code aws_subnet} for {@code module.x.aws_subnet.a~1}).
     *
     * @param id resource identifier
     * @return resource type
     */
    public static String typeOf(String id) {
        String local = stripModule(id);
        int dot = local.indexOf('.');
        return dot < 0 ? local : local.substring(0, dot);
    }

    /**
     * Returns the instance name without module path or number suffix.
     *
     * @param id resource identifier
     * @return instance name, or an empty string when the identifier has no name part
     */
    public static String nameOf(String id) {
        String local = baseName(stripModule(id));
        int dot = local.indexOf('.');
        return dot < 0 ? "" : local.substring(dot + 1);
    }

    public static boolean isNumbered(String id) {
        return id.contains(NUMBER_SEPARATOR);
    }

    /**
     * Returns the synthetic instance number, if any.
     *
     * @param id resource identifier
     * @return suffix after {@code ~}
     */
    public static Optional<String> numberOf(String id) {
        int idx = id.indexOf(NUMBER_SEPARATOR);
        if (idx < 0 || idx == id.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(id.substring(idx + 1));
    }

    /**
     * Removes the synthetic instance number.
     *
     * @param id resource identifier
     * @return identifier without {@code ~N}
     */
    public static String baseName(String id) {
        int idx = id.indexOf(NUMBER_SEPARATOR);
        return idx < 0 ? id : id.substring(0, idx);
    }

    public static String numbered(String id, int number) {
        return baseName(id) + NUMBER_SEPARATOR + number;
    }

    public static String numbered(String id, String number) {
        return baseName(id) + NUMBER_SEPARATOR + number;
    }

    /**
     * Checks whether two identifiers may reference each other with respect to numbering:
     * two numbered identifiers are compatible only when they carry the same number.
     *
     * @param a first identifier
     * @param b second identifier
     * @return true unless both are numbered with different numbers
     */
    public static boolean sameNumbering(String a, String b) {
        if (!isNumbered(a) || !isNumbered(b)) {
            return true;
        }
        return numberOf(a).equals(numberOf(b));
    }

    /**
     * Checks whether the identifier's module-less form starts with any of the prefixes.
     *
     * @param id resource identifier
     * @param prefixes candidate prefixes
     * @return true on the first matching prefix
     */
    public static boolean startsWithAny(String id, Collection<String> prefixes) {
        String local = stripModule(id);
        for (String prefix : prefixes) {
            if (local.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether the identifier's type equals any of the given types.
     *
     * @param id resource identifier
     * @param types candidate types
     * @return true when the type is listed
     */
    public static boolean isTypeIn(String id, Collection<String> types) {
        return types.contains(typeOf(id));
    }
}
