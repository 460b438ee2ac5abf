package com.namingtool.model.naming;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Component name normalization shared by the composer, the accessor table and the pipeline.
 */
public final class ComponentNames {

    private ComponentNames() {
    }

    /**
     * Remove "Resource" and all spaces, then lower-case.
     * {@code ResourceUnitDept} becomes {@code unitdept}, {@code Cost Center} becomes {@code costcenter}.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.replace("Resource", "").replace(" ", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a comma-separated component list into a set of normalized names.
     */
    public static Set<String> parseNameSet(String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(commaSeparated.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(ComponentNames::normalize)
            .collect(Collectors.toUnmodifiableSet());
    }
}
