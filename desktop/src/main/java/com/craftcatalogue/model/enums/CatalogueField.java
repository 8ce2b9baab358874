package com.craftcatalogue.model.enums;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Columns of the catalogue as they appear in spreadsheets, in export order.
 * Each field accepts its header plus a few common aliases when importing.
 */
public enum CatalogueField {
    NAME("Name", List.of("component name", "item name")),
    CATEGORY("Category", List.of("type", "group")),
    DESCRIPTION("Description", List.of("desc", "details")),
    QUANTITY("Quantity", List.of("qty", "amount", "count")),
    UNIT("Unit", List.of("units", "measurement")),
    COST_PER_UNIT("Cost per Unit", List.of("cost/unit", "price", "unit cost", "cost")),
    SUPPLIER("Supplier", List.of("vendor", "source")),
    LOCATION("Location", List.of("storage", "place")),
    NOTES("Notes", List.of("comments", "remarks"));

    private final String header;
    private final List<String> aliases;

    CatalogueField(String header, List<String> aliases) {
        this.header = header;
        this.aliases = aliases;
    }

    public String getHeader() {
        return header;
    }

    /**
     * True if the given spreadsheet header names this field (case-insensitive).
     */
    public boolean matches(String columnHeader) {
        if (columnHeader == null) {
            return false;
        }
        String normalized = columnHeader.trim().toLowerCase(Locale.ROOT);
        return header.toLowerCase(Locale.ROOT).equals(normalized) || aliases.contains(normalized);
    }

    public static Optional<CatalogueField> fromHeader(String columnHeader) {
        for (CatalogueField field : values()) {
            if (field.matches(columnHeader)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
