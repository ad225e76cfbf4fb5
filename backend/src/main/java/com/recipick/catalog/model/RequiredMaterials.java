package com.recipick.catalog.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

public record RequiredMaterials(Set<String> core, Set<String> optional) {

    public static final RequiredMaterials NONE = new RequiredMaterials(Set.of(), Set.of());

    public RequiredMaterials {
        core = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(core, "core")));
        optional = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(optional, "optional")));
    }

    public static RequiredMaterials flat(Collection<String> materials) {
        return new RequiredMaterials(new LinkedHashSet<>(materials), Set.of());
    }

    public static RequiredMaterials of(Collection<String> core, Collection<String> optional) {
        return new RequiredMaterials(new LinkedHashSet<>(core), new LinkedHashSet<>(optional));
    }

    public boolean isEmpty() {
        return core.isEmpty() && optional.isEmpty();
    }

    // flat array = all core; object = {core, optional}
    public static RequiredMaterials fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("required materials are missing");
        }

        if (node.isArray()) {
            return flat(readNames(node, "materials"));
        }

        if (node.isObject()) {
            return of(readNames(node.path("core"), "core"), readNames(node.path("optional"), "optional"));
        }

        throw new IllegalArgumentException("required materials must be an array or an object, got " + node.getNodeType());
    }

    private static Set<String> readNames(JsonNode node, String field) {
        Set<String> names = new LinkedHashSet<>();
        if (node.isMissingNode() || node.isNull()) {
            return names;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("'" + field + "' must be an array");
        }

        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("'" + field + "' contains a non-text entry: " + element);
            }
            String name = element.asText().trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
