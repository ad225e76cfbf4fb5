package com.recipick.matching;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps receipt lines to standard material names. Immutable.
 */
public final class MaterialNormalizer {

    private static final MaterialNormalizer EMPTY = new MaterialNormalizer(Map.of(), null);

    private final Map<String, String> mapping;
    private final Pattern pattern;

    private MaterialNormalizer(Map<String, String> mapping, Pattern pattern) {
        this.mapping = mapping;
        this.pattern = pattern;
    }

    public static MaterialNormalizer empty() {
        return EMPTY;
    }

    public static MaterialNormalizer build(Map<String, String> mapping) {
        if (mapping == null || mapping.isEmpty()) {
            return EMPTY;
        }

        Map<String, String> usable = new LinkedHashMap<>();
        mapping.forEach((item, material) -> {
            if (item != null && !item.isEmpty() && material != null && !material.isBlank()) {
                usable.put(item, material);
            }
        });
        if (usable.isEmpty()) {
            return EMPTY;
        }

        // longest key first, so 냉동삼겹살 is tried before 삼겹살 at the same offset
        List<String> keys = usable.keySet().stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .toList();
        String alternation = keys.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));

        return new MaterialNormalizer(Collections.unmodifiableMap(usable), Pattern.compile(alternation));
    }

    public Set<String> normalize(Collection<String> lines) {
        Set<String> materials = new LinkedHashSet<>();
        if (pattern == null || lines == null) {
            return materials;
        }

        for (String line : lines) {
            if (line == null) {
                continue;
            }
            String cleaned = line.strip();
            if (cleaned.isEmpty()) {
                continue;
            }

            Matcher matcher = pattern.matcher(cleaned);
            while (matcher.find()) {
                String material = mapping.get(matcher.group());
                if (material != null) {
                    materials.add(material);
                }
            }
        }
        return materials;
    }

    public int size() {
        return mapping.size();
    }
}
