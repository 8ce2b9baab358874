package com.craftcatalogue.ui;

import com.craftcatalogue.dto.response.ComponentDto;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Client-side filtering of the last fetched components.
 * Matches the same way as the catalogue search: case-insensitive substring
 * on name, category or description, optionally limited to one category.
 */
public final class ComponentFilter {

    public static final String ALL_CATEGORIES = "All Categories";

    private ComponentFilter() {
    }

    public static List<ComponentDto> apply(List<ComponentDto> components, String text, String category) {
        String needle = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        boolean anyCategory = category == null || category.isBlank() || ALL_CATEGORIES.equals(category);

        return components.stream()
            .filter(c -> anyCategory || category.equals(c.category()))
            .filter(c -> needle.isEmpty()
                || contains(c.name(), needle)
                || contains(c.category(), needle)
                || contains(c.description(), needle))
            .collect(Collectors.toList());
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
